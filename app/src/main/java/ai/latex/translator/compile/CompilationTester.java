package ai.latex.translator.compile;

import ai.latex.translator.project.LatexFile;
import ai.latex.translator.project.ProjectAssets;
import ai.latex.translator.project.ProjectModel;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles the current content of a project model in a scratch directory. The scratch directory is
 * removed before {@link #test} returns, so a produced PDF is only kept when a PDF directory is set.
 */
public class CompilationTester {

    private static final Logger LOGGER = LoggerFactory.getLogger(CompilationTester.class);

    private final Path scratchParent;
    private final Path pdfDirectory;
    private final boolean copyAssets;

    public CompilationTester() {
        this(null, null, true);
    }

    /**
     * @param scratchParent directory to create scratch directories in, or {@code null} for the system default
     * @param pdfDirectory directory receiving the produced PDF, or {@code null} to discard it
     * @param copyAssets whether non-LaTeX files under the model root are copied next to the sources
     */
    public CompilationTester(Path scratchParent, Path pdfDirectory, boolean copyAssets) {
        this.scratchParent = scratchParent;
        this.pdfDirectory = pdfDirectory;
        this.copyAssets = copyAssets;
    }

    public CompileOutcome test(ProjectModel model, LatexCompiler compiler, CompileSetting template) {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(compiler, "compiler");
        Objects.requireNonNull(template, "template");
        Optional<String> mainFile = model.mainFile();
        if (mainFile.isEmpty()) {
            return CompileOutcome.failure(CompileErrorType.COMPILE_ERROR, "No main file to compile", "");
        }
        Path scratch = null;
        try {
            scratch = scratchParent == null
                    ? Files.createTempDirectory("latex-compile-")
                    : Files.createTempDirectory(scratchParent, "latex-compile-");
            materialize(model, scratch, mainFile.get(), template.extraPreamble());
            CompileSetting setting = template.withSource(scratch, mainFile.get());
            CompileOutcome outcome = compiler.compile(setting);
            if (outcome.isSuccess()) {
                return keepPdf(outcome);
            }
            outcome.error().ifPresent(error -> LOGGER.warn("Compile test failed ({}): {}", error.type(), error.message()));
            return outcome;
        } catch (IOException ex) {
            LOGGER.error("Compile test could not prepare {}: {}", scratch, ex.getMessage());
            return CompileOutcome.failure(CompileErrorType.COMPILE_ERROR, "Compile test failed: " + ex.getMessage(), "");
        } finally {
            if (scratch != null) {
                try {
                    ProjectAssets.deleteRecursively(scratch);
                } catch (IOException ex) {
                    LOGGER.warn("Could not delete scratch directory {}: {}", scratch, ex.getMessage());
                }
            }
        }
    }

    private void materialize(ProjectModel model, Path scratch, String mainFile, String extraPreamble) throws IOException {
        if (copyAssets) {
            ProjectAssets.copy(model.root(), scratch, model.files().keySet());
        }
        for (LatexFile file : model.files().values()) {
            String content = file.content();
            if (file.path().equals(mainFile) && !extraPreamble.isBlank()) {
                content = injectPreamble(content, extraPreamble);
            }
            Path target = scratch.resolve(file.path());
            Files.createDirectories(target.getParent());
            Files.writeString(target, content, StandardCharsets.UTF_8);
        }
    }

    static String injectPreamble(String content, String extraPreamble) {
        int index = content.indexOf("\\begin{document}");
        if (index < 0) {
            return content;
        }
        return content.substring(0, index) + extraPreamble.strip() + "\n" + content.substring(index);
    }

    private CompileOutcome keepPdf(CompileOutcome outcome) throws IOException {
        if (pdfDirectory == null || outcome.pdf().isEmpty()) {
            return CompileOutcome.success(null);
        }
        Path source = outcome.pdf().get();
        Files.createDirectories(pdfDirectory);
        Path target = pdfDirectory.resolve(source.getFileName().toString());
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        return CompileOutcome.success(target);
    }
}
