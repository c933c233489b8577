package ai.latex.translator.translate;

/**
 * Translator used for dry runs: returns the source unchanged without invoking remote APIs.
 */
public class PassThroughTranslator implements Translator {

    @Override
    public String translate(String text, TargetLanguage targetLanguage, String context) {
        return text == null ? "" : text;
    }
}
