package ai.latex.translator.translate;

/**
 * Marks every span so tests and demos can see what would have been translated.
 */
public class MockTranslator implements Translator {

    static final String MARKER = "MOCK ";

    @Override
    public String translate(String text, TargetLanguage targetLanguage, String context) {
        if (text == null || text.isBlank()) {
            return text == null ? "" : text;
        }
        return MARKER + targetLanguage.code() + ": " + text;
    }
}
