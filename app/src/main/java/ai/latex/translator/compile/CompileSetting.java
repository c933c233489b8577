package ai.latex.translator.compile;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * What to compile and how. {@code extraPreamble} is inserted before {@code \begin{document}} of the
 * target file when the project is materialized for a compile test.
 */
public record CompileSetting(LatexEngine engine, String targetFileName, Path sourceDirectory, boolean useBibtex,
                             Duration timeout, String extraPreamble) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    public CompileSetting {
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(targetFileName, "targetFileName");
        Objects.requireNonNull(sourceDirectory, "sourceDirectory");
        if (targetFileName.isBlank()) {
            throw new IllegalArgumentException("targetFileName must not be blank");
        }
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        extraPreamble = extraPreamble == null ? "" : extraPreamble;
    }

    public static CompileSetting of(Path sourceDirectory, String targetFileName) {
        return new CompileSetting(LatexEngine.PDFLATEX, targetFileName, sourceDirectory, false, DEFAULT_TIMEOUT, "");
    }

    public CompileSetting withSource(Path directory, String target) {
        return new CompileSetting(engine, target, directory, useBibtex, timeout, extraPreamble);
    }

    /**
     * Target file name with its extension replaced by {@code extension}.
     */
    public String targetWithExtension(String extension) {
        int dot = targetFileName.lastIndexOf('.');
        int slash = targetFileName.lastIndexOf('/');
        String base = dot > slash ? targetFileName.substring(0, dot) : targetFileName;
        return base + extension;
    }
}
