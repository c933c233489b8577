package ai.latex.translator.parser;

import java.util.Objects;

/**
 * Substitute text for the half-open range {@code [start, end)} of an original source.
 */
public record TextReplacement(String text, int start, int end) {

    public TextReplacement {
        Objects.requireNonNull(text, "text");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid replacement range [" + start + ", " + end + ")");
        }
    }

    public TextReplacement withText(String replacement) {
        return new TextReplacement(replacement, start, end);
    }
}
