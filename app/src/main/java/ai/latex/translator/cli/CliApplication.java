package ai.latex.translator.cli;

import ai.latex.translator.compile.CompilationTester;
import ai.latex.translator.compile.CompileOutcome;
import ai.latex.translator.compile.LatexCompiler;
import ai.latex.translator.compile.LatexmkCompiler;
import ai.latex.translator.config.Config;
import ai.latex.translator.config.ConfigLoader;
import ai.latex.translator.config.Mode;
import ai.latex.translator.config.Secrets;
import ai.latex.translator.config.SystemEnvironmentReader;
import ai.latex.translator.config.TranslatorConfig;
import ai.latex.translator.logging.LoggingConfigurator;
import ai.latex.translator.parser.LatexParser;
import ai.latex.translator.project.LatexProjectAnalyzer;
import ai.latex.translator.project.ProjectModel;
import ai.latex.translator.project.ProjectStructure;
import ai.latex.translator.translate.ChatModelTranslator;
import ai.latex.translator.translate.LatexTranslationService;
import ai.latex.translator.translate.MockTranslator;
import ai.latex.translator.translate.PassThroughTranslator;
import ai.latex.translator.translate.TranslationMode;
import ai.latex.translator.translate.TranslatorFactory;
import ai.latex.translator.validate.LatexValidator;
import ai.latex.translator.validate.ValidationIssue;
import ai.latex.translator.workflow.TranslationWorkflow;
import ai.latex.translator.workflow.WorkflowException;
import ai.latex.translator.workflow.WorkflowRequest;
import ai.latex.translator.workflow.WorkflowResult;
import ai.latex.translator.writer.ProjectWriter;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and workflow.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final LatexCompiler compiler;
    private final PrintWriter out;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new LatexmkCompiler(),
                new PrintWriter(System.out, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, LatexCompiler compiler, PrintWriter out) {
        this.configLoader = configLoader;
        this.compiler = compiler;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Running in {} mode on {}", config.mode(), config.projectRoot());

        LatexParser parser = new LatexParser();
        LatexProjectAnalyzer analyzer = new LatexProjectAnalyzer(parser, config.latexExtensions());
        try {
            if (config.mode() == Mode.ANALYZE) {
                printStructure(analyzer.analyze(config.projectRoot()));
                return 0;
            }
            TranslationWorkflow workflow = new TranslationWorkflow(analyzer, new LatexValidator(parser),
                    createTranslationService(config, parser), new CompilationTester(), compiler, new ProjectWriter());
            WorkflowResult result = workflow.run(toRequest(config));
            printResult(result);
            return result.successful() ? 0 : 1;
        } catch (IllegalArgumentException | IllegalStateException | WorkflowException ex) {
            LOGGER.error("Run failed: {}", ex.getMessage(), ex);
            return 1;
        } finally {
            out.flush();
        }
    }

    static WorkflowRequest toRequest(Config config) {
        return new WorkflowRequest(config.projectRoot(), config.outputDirectory(), config.mode().isTranslate(),
                config.targetLanguage(), config.translationMode(), config.maxFilesPerRun(), config.autoFix(),
                config.compile(), config.engine(), config.useBibtex(), config.compileTimeout());
    }

    private void printStructure(ProjectModel model) {
        ProjectStructure structure = model.structure();
        out.println("Main file: " + structure.mainFile().orElse("<none>") + " (" + model.mainFileSelection() + ")");
        out.println("Files: " + structure.totalFiles());
        out.println("Custom commands: " + structure.customCommands());
        out.println("Custom environments: " + structure.customEnvironments());
        out.println("Compilation order: " + String.join(", ", model.compilationOrder()));
        for (List<String> cycle : model.cycles()) {
            out.println("Circular dependency: " + String.join(" -> ", cycle));
        }
        model.readFailures().forEach(failure -> out.println("Unreadable: " + failure.path() + " (" + failure.message() + ")"));
    }

    private void printResult(WorkflowResult result) {
        for (ValidationIssue issue : result.finalReport().issues()) {
            out.println(issue.describe());
        }
        if (!result.fixedFiles().isEmpty()) {
            out.println("Auto-fixed: " + String.join(", ", result.fixedFiles()));
        }
        result.translation().ifPresent(outcome -> out.println("Translated files: " + outcome.processedFiles()
                + (outcome.failedFiles().isEmpty() ? "" : " (failed: " + String.join(", ", outcome.failedFiles()) + ")")));
        result.compileOutcome().ifPresent(this::printCompileOutcome);
        result.written().ifPresent(summary -> out.println("Wrote " + summary.totalFiles() + " files"));
        out.println("Errors: " + result.finalReport().errorCount() + ", warnings: " + result.finalReport().warningCount()
                + ", compilable: " + result.finalReport().compilable());
    }

    private void printCompileOutcome(CompileOutcome outcome) {
        if (outcome.isSuccess()) {
            out.println("Compile test: success");
            return;
        }
        outcome.error().ifPresent(error -> out.println("Compile test: " + error.type() + " " + error.message()));
    }

    private LatexTranslationService createTranslationService(Config config, LatexParser parser) {
        TranslatorFactory factory = needsChatModel(config) ? buildTranslatorFactory(config) : TranslatorFactory.offline();
        return new LatexTranslationService(factory, parser,
                config.llmMaxRetryAttempts(),
                config.llmInitialBackoffSeconds(),
                config.llmMaxBackoffSeconds(),
                config.llmRetryJitterFactor());
    }

    private static boolean needsChatModel(Config config) {
        return config.mode().isTranslate() && config.translationMode() == TranslationMode.PRODUCTION;
    }

    private TranslatorFactory buildTranslatorFactory(Config config) {
        TranslatorConfig translatorConfig = config.translatorConfig();
        ChatModel chatModel = switch (translatorConfig.provider()) {
            case OLLAMA -> createOllamaChatModel(translatorConfig);
            case GEMINI -> createGeminiChatModel(translatorConfig, config.secrets());
        };
        return new TranslatorFactory(
                new ChatModelTranslator(chatModel, translatorConfig.provider().name(), translatorConfig.modelName()),
                new PassThroughTranslator(),
                new MockTranslator());
    }

    private ChatModel createOllamaChatModel(TranslatorConfig translatorConfig) {
        try {
            String baseUrl = translatorConfig.baseUrl()
                    .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.info("Translating with {}", translatorConfig.describe());
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(translatorConfig.modelName())
                    .temperature(0.1)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private ChatModel createGeminiChatModel(TranslatorConfig translatorConfig, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Translating with {}", translatorConfig.describe());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(translatorConfig.modelName())
                    .temperature(0.1)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
