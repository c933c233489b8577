package ai.latex.translator.validate;

import java.util.Locale;

/**
 * Categories of validation findings. {@link #code()} is the stable identifier used in reports.
 */
public enum IssueKind {
    MISSING_MAIN_FILE,
    MAIN_FILE_FALLBACK,
    MISSING_DOCUMENTCLASS,
    MISSING_BEGIN_DOCUMENT,
    MISSING_END_DOCUMENT,
    UNREADABLE_FILE,
    UNMATCHED_BRACES,
    UNMATCHED_MATH_DELIMITERS,
    UNKNOWN_COMMAND,
    MISSING_DEPENDENCY,
    CIRCULAR_DEPENDENCY,
    MISSING_LABEL,
    MISSING_COMMAND_DEPENDENCY,
    UNMATCHED_ENVIRONMENT,
    UNCLOSED_ENVIRONMENT;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static IssueKind fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Issue code must not be blank");
        }
        return IssueKind.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
