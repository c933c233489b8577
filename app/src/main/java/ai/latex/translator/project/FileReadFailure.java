package ai.latex.translator.project;

import java.util.Objects;

/**
 * A discovered source file whose content could not be read.
 */
public record FileReadFailure(String path, String message) {

    public FileReadFailure {
        Objects.requireNonNull(path, "path");
        message = message == null ? "" : message;
    }
}
