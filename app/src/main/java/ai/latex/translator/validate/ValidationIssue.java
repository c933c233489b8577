package ai.latex.translator.validate;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * One finding of the validator. {@code filePath} is empty for project-wide issues.
 */
public record ValidationIssue(IssueKind kind, Severity severity, String message, String filePath,
                              OptionalInt lineNumber, Optional<String> suggestion) {

    public ValidationIssue {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
        filePath = filePath == null ? "" : filePath;
        lineNumber = lineNumber == null ? OptionalInt.empty() : lineNumber;
        suggestion = suggestion == null ? Optional.empty() : suggestion;
    }

    public static ValidationIssue error(IssueKind kind, String filePath, String message, String suggestion) {
        return new ValidationIssue(kind, Severity.ERROR, message, filePath, OptionalInt.empty(), Optional.ofNullable(suggestion));
    }

    public static ValidationIssue warning(IssueKind kind, String filePath, int line, String message, String suggestion) {
        return new ValidationIssue(kind, Severity.WARNING, message, filePath,
                line > 0 ? OptionalInt.of(line) : OptionalInt.empty(), Optional.ofNullable(suggestion));
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Single line rendering, {@code SEVERITY kind path:line message}.
     */
    public String describe() {
        StringBuilder builder = new StringBuilder()
                .append(severity).append(' ').append(kind.code());
        if (!filePath.isEmpty()) {
            builder.append(' ').append(filePath);
            lineNumber.ifPresent(line -> builder.append(':').append(line));
        }
        builder.append(' ').append(message);
        return builder.toString();
    }
}
