package ai.latex.translator.parser;

/**
 * Classification of a lexical span of LaTeX source.
 */
public enum ElementKind {
    TEXT,
    MATH_INLINE,
    MATH_DISPLAY,
    COMMAND,
    ENVIRONMENT,
    COMMENT,
    CITATION,
    REFERENCE,
    LABEL;

    public boolean isMath() {
        return this == MATH_INLINE || this == MATH_DISPLAY;
    }
}
