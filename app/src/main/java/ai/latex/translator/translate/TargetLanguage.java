package ai.latex.translator.translate;

import java.util.Locale;

/**
 * Languages documents can be translated into.
 */
public enum TargetLanguage {
    JAPANESE("Japanese", "ja", "\\usepackage[whole]{bxcjkjatype}"),
    ENGLISH("English", "en", ""),
    CHINESE("Simplified Chinese", "zh", ""),
    KOREAN("Korean", "ko", "");

    private final String displayName;
    private final String code;
    private final String compilePreamble;

    TargetLanguage(String displayName, String code, String compilePreamble) {
        this.displayName = displayName;
        this.code = code;
        this.compilePreamble = compilePreamble;
    }

    public String displayName() {
        return displayName;
    }

    public String code() {
        return code;
    }

    /**
     * Preamble lines a pdfLaTeX compile of a document in this language needs, empty when none.
     */
    public String compilePreamble() {
        return compilePreamble;
    }

    public static TargetLanguage from(String raw) {
        if (raw == null || raw.isBlank()) {
            return JAPANESE;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TargetLanguage language : values()) {
            if (language.name().equalsIgnoreCase(normalized) || language.code.equals(normalized)) {
                return language;
            }
        }
        throw new IllegalArgumentException("Unsupported target language: " + raw);
    }
}
