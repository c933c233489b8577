package ai.latex.translator.config;

/**
 * What a CLI run does with the project.
 */
public enum Mode {
    ANALYZE,
    VALIDATE,
    TRANSLATE;

    public static Mode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return VALIDATE;
        }
        for (Mode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported mode: " + raw);
    }

    public boolean isTranslate() {
        return this == TRANSLATE;
    }
}
