package ai.latex.translator.translate;

import java.util.Optional;

/**
 * Runtime exception used to propagate translation failures. Failures raised while translating a project
 * carry the path of the LaTeX file whose span failed.
 */
public class TranslationException extends RuntimeException {

    private final String latexFile;

    public TranslationException(String message) {
        this(message, null, null);
    }

    public TranslationException(String message, Throwable cause) {
        this(message, cause, null);
    }

    private TranslationException(String message, Throwable cause, String latexFile) {
        super(message, cause);
        this.latexFile = latexFile;
    }

    public Optional<String> latexFile() {
        return Optional.ofNullable(latexFile);
    }

    /**
     * Same failure attributed to {@code path}; message, cause and stack trace are kept.
     */
    public TranslationException inFile(String path) {
        if (latexFile != null) {
            return this;
        }
        TranslationException tagged = new TranslationException(getMessage(), getCause(), path);
        tagged.setStackTrace(getStackTrace());
        return tagged;
    }
}
