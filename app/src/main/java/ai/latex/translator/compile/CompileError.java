package ai.latex.translator.compile;

import java.util.Objects;

/**
 * A failed compilation. {@code message} holds the critical lines extracted from the log, {@code log}
 * the raw log when one was produced.
 */
public record CompileError(CompileErrorType type, String message, String log) {

    public CompileError {
        Objects.requireNonNull(type, "type");
        message = message == null ? "" : message;
        log = log == null ? "" : log;
    }

    public boolean isTimeout() {
        return type == CompileErrorType.COMPILE_TIMEOUT;
    }
}
