package ai.latex.translator.parser;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A classified, position-tagged span {@code [start, end)} of LaTeX source.
 */
public record LatexElement(ElementKind kind, String content, int start, int end, boolean translatable,
                           Map<String, String> metadata) {

    public static final String META_COMMAND = "command";
    public static final String META_ENVIRONMENT = "environment";
    public static final String META_BOUNDARY = "boundary";
    public static final String META_KEYS = "keys";
    public static final String META_KEY = "key";
    public static final String META_ARGUMENTS = "arguments";
    public static final String META_WHITESPACE = "whitespace";

    public static final String BOUNDARY_BEGIN = "begin";
    public static final String BOUNDARY_END = "end";
    public static final String BOUNDARY_BLOCK = "block";

    public LatexElement {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(content, "content");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid element boundaries");
        }
        if (content.length() != end - start) {
            throw new IllegalArgumentException("Element content does not match its boundaries");
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public int length() {
        return end - start;
    }

    public Optional<String> metadata(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    /**
     * Name of the command or environment this element stands for, if any.
     */
    public Optional<String> name() {
        return switch (kind) {
            case ENVIRONMENT -> metadata(META_ENVIRONMENT);
            case COMMAND, CITATION, REFERENCE -> metadata(META_COMMAND);
            case LABEL -> Optional.of("label");
            default -> Optional.empty();
        };
    }

    public boolean isBoundary(String boundary) {
        return kind == ElementKind.ENVIRONMENT && boundary.equals(metadata.get(META_BOUNDARY));
    }

    public boolean overlaps(LatexElement other) {
        return start < other.end && other.start < end;
    }
}
