package ai.latex.translator.workflow;

import ai.latex.translator.compile.CompileOutcome;
import ai.latex.translator.project.ProjectModel;
import ai.latex.translator.translate.TranslationOutcome;
import ai.latex.translator.translate.TranslationResult;
import ai.latex.translator.validate.ValidationReport;
import ai.latex.translator.writer.WriteSummary;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything a workflow run produced. {@code model} holds the final content of every file.
 */
public record WorkflowResult(ProjectModel model,
                             ValidationReport initialReport,
                             ValidationReport finalReport,
                             List<String> fixedFiles,
                             Optional<TranslationOutcome> translation,
                             Optional<CompileOutcome> compileOutcome,
                             Optional<WriteSummary> written) {

    public WorkflowResult {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(initialReport, "initialReport");
        Objects.requireNonNull(finalReport, "finalReport");
        fixedFiles = fixedFiles == null ? List.of() : List.copyOf(fixedFiles);
        translation = translation == null ? Optional.empty() : translation;
        compileOutcome = compileOutcome == null ? Optional.empty() : compileOutcome;
        written = written == null ? Optional.empty() : written;
    }

    public List<String> translatedFiles() {
        return translation.map(outcome -> outcome.results().stream()
                        .map(TranslationResult::filePath)
                        .toList())
                .orElse(List.of());
    }

    public List<String> failedFiles() {
        return translation.map(TranslationOutcome::failedFiles).orElse(List.of());
    }

    public List<String> writtenFiles() {
        return written.map(WriteSummary::sources).orElse(List.of());
    }

    /**
     * Whether the final report has no errors and, when a compile test ran, the compile succeeded.
     */
    public boolean successful() {
        return finalReport.compilable() && compileOutcome.map(CompileOutcome::isSuccess).orElse(true);
    }
}
