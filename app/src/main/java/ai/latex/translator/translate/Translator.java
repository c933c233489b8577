package ai.latex.translator.translate;

/**
 * Low-level translator converting one natural-language span into the target language.
 */
public interface Translator {

    /**
     * @param text source span, possibly containing inline LaTeX commands that must survive untouched
     * @param context free-form hints such as the current section heading, may be empty
     */
    String translate(String text, TargetLanguage targetLanguage, String context);
}
