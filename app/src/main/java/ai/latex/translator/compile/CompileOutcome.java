package ai.latex.translator.compile;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of a compilation: the produced PDF or the error.
 */
public record CompileOutcome(Optional<Path> pdf, Optional<CompileError> error) {

    public CompileOutcome {
        Objects.requireNonNull(pdf, "pdf");
        Objects.requireNonNull(error, "error");
        if (error.isPresent() && pdf.isPresent()) {
            throw new IllegalArgumentException("A failed compilation cannot carry a PDF");
        }
    }

    public static CompileOutcome success(Path pdf) {
        return new CompileOutcome(Optional.ofNullable(pdf), Optional.empty());
    }

    public static CompileOutcome failure(CompileErrorType type, String message, String log) {
        return new CompileOutcome(Optional.empty(), Optional.of(new CompileError(type, message, log)));
    }

    public boolean isSuccess() {
        return error.isEmpty();
    }
}
