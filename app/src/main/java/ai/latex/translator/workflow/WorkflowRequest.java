package ai.latex.translator.workflow;

import ai.latex.translator.compile.CompileSetting;
import ai.latex.translator.compile.LatexEngine;
import ai.latex.translator.translate.TargetLanguage;
import ai.latex.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Parameters of one {@link TranslationWorkflow} run. When {@code translate} is false the run stops after
 * validation and optional auto-fix.
 */
public record WorkflowRequest(Path projectRoot,
                              Optional<Path> outputRoot,
                              boolean translate,
                              TargetLanguage targetLanguage,
                              TranslationMode translationMode,
                              int maxFiles,
                              boolean autoFix,
                              boolean compile,
                              LatexEngine engine,
                              boolean useBibtex,
                              Duration compileTimeout) {

    public WorkflowRequest {
        Objects.requireNonNull(projectRoot, "projectRoot");
        outputRoot = outputRoot == null ? Optional.empty() : outputRoot;
        targetLanguage = targetLanguage == null ? TargetLanguage.JAPANESE : targetLanguage;
        translationMode = translationMode == null ? TranslationMode.PRODUCTION : translationMode;
        if (maxFiles < 0) {
            throw new IllegalArgumentException("maxFiles must be greater than or equal to zero");
        }
        engine = engine == null ? LatexEngine.PDFLATEX : engine;
        compileTimeout = compileTimeout == null ? CompileSetting.DEFAULT_TIMEOUT : compileTimeout;
    }

    /**
     * Validation-only request with default compile settings.
     */
    public static WorkflowRequest validation(Path projectRoot, boolean autoFix) {
        return new WorkflowRequest(projectRoot, Optional.empty(), false, TargetLanguage.JAPANESE,
                TranslationMode.DRY_RUN, 0, autoFix, false, LatexEngine.PDFLATEX, false, CompileSetting.DEFAULT_TIMEOUT);
    }
}
