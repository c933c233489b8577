package ai.latex.translator.parser;

import java.util.Objects;

/**
 * A slice of a document starting at a sectioning command. The heading is empty for the
 * text preceding the first heading.
 */
public record SectionSlice(String heading, String text) {

    public SectionSlice {
        Objects.requireNonNull(heading, "heading");
        Objects.requireNonNull(text, "text");
    }

    public boolean isPreamble() {
        return heading.isEmpty();
    }
}
