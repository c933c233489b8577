package ai.latex.translator.workflow;

import ai.latex.translator.compile.CompilationTester;
import ai.latex.translator.compile.CompileOutcome;
import ai.latex.translator.compile.CompileSetting;
import ai.latex.translator.compile.LatexCompiler;
import ai.latex.translator.compile.LatexEngine;
import ai.latex.translator.project.LatexProjectAnalyzer;
import ai.latex.translator.project.ProjectModel;
import ai.latex.translator.translate.LatexTranslationService;
import ai.latex.translator.translate.TranslationOutcome;
import ai.latex.translator.validate.LatexValidator;
import ai.latex.translator.validate.ValidationReport;
import ai.latex.translator.writer.ProjectWriter;
import ai.latex.translator.writer.WriteSummary;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs analysis, validation, repair, translation, compile test and output in that order.
 *
 * <p>Fixes and translations are applied to the model and the project is analyzed again before each
 * validation, so reports always describe the content that will be written.</p>
 */
public class TranslationWorkflow {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationWorkflow.class);

    private final LatexProjectAnalyzer analyzer;
    private final LatexValidator validator;
    private final LatexTranslationService translationService;
    private final CompilationTester compilationTester;
    private final LatexCompiler compiler;
    private final ProjectWriter writer;

    public TranslationWorkflow(LatexProjectAnalyzer analyzer,
                               LatexValidator validator,
                               LatexTranslationService translationService,
                               CompilationTester compilationTester,
                               LatexCompiler compiler,
                               ProjectWriter writer) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.translationService = Objects.requireNonNull(translationService, "translationService");
        this.compilationTester = Objects.requireNonNull(compilationTester, "compilationTester");
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    public WorkflowResult run(WorkflowRequest request) {
        Objects.requireNonNull(request, "request");
        ProjectModel model = analyze(request);
        ValidationReport initialReport = validator.validate(model);
        LOGGER.info("Initial validation: {} errors, {} warnings", initialReport.errorCount(), initialReport.warningCount());

        Set<String> fixedFiles = new LinkedHashSet<>();
        ValidationReport report = initialReport;
        if (request.autoFix() || !initialReport.compilable()) {
            Map<String, String> fixes = validator.autoFixIssues(model);
            if (!fixes.isEmpty()) {
                fixedFiles.addAll(fixes.keySet());
                model.applyContent(fixes);
                model = analyzer.reanalyze(model);
                report = validator.validate(model);
                LOGGER.info("Auto-fixed {} files; {} errors remain", fixes.size(), report.errorCount());
            }
        }

        Optional<TranslationOutcome> translation = Optional.empty();
        if (request.translate()) {
            TranslationOutcome outcome = translationService.translateProject(model, request.targetLanguage(),
                    request.translationMode(), request.maxFiles());
            translation = Optional.of(outcome);
            model.applyContent(outcome.contents());
            Map<String, String> fixes = validator.autoFixIssues(model);
            fixedFiles.addAll(fixes.keySet());
            model.applyContent(fixes);
            model = analyzer.reanalyze(model);
            report = validator.validate(model);
            LOGGER.info("Translated {} files ({} failed); {} errors after translation",
                    outcome.processedFiles(), outcome.failedFiles().size(), report.errorCount());
        }

        Optional<CompileOutcome> compileOutcome = Optional.empty();
        if (request.compile()) {
            compileOutcome = Optional.of(compile(model, request));
        }

        Optional<WriteSummary> written = Optional.empty();
        if (request.outputRoot().isPresent()) {
            written = Optional.of(write(model, request));
        }

        return new WorkflowResult(model, initialReport, report, new ArrayList<>(fixedFiles), translation,
                compileOutcome, written);
    }

    private ProjectModel analyze(WorkflowRequest request) {
        try {
            return analyzer.analyze(request.projectRoot());
        } catch (IllegalArgumentException | UncheckedIOException ex) {
            throw new WorkflowException("Failed to analyze project " + request.projectRoot() + ": " + ex.getMessage(), ex);
        }
    }

    private CompileOutcome compile(ProjectModel model, WorkflowRequest request) {
        String preamble = request.translate() && request.engine() == LatexEngine.PDFLATEX
                ? request.targetLanguage().compilePreamble()
                : "";
        CompileSetting template = new CompileSetting(request.engine(), model.mainFile().orElse("main.tex"),
                model.root(), request.useBibtex(), request.compileTimeout(), preamble);
        CompileOutcome outcome = compilationTester.test(model, compiler, template);
        if (outcome.isSuccess()) {
            LOGGER.info("Compile test succeeded");
        }
        return outcome;
    }

    private WriteSummary write(ProjectModel model, WorkflowRequest request) {
        try {
            return writer.write(request.projectRoot(), request.outputRoot().get(), model.contents());
        } catch (UncheckedIOException | IllegalStateException ex) {
            throw new WorkflowException("Failed to write output project: " + ex.getMessage(), ex);
        }
    }
}
