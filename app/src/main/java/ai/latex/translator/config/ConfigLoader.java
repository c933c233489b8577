package ai.latex.translator.config;

import ai.latex.translator.cli.CliArguments;
import ai.latex.translator.compile.CompileSetting;
import ai.latex.translator.compile.LatexEngine;
import ai.latex.translator.translate.TargetLanguage;
import ai.latex.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_MODE = "MODE";
    static final String ENV_TARGET_LANGUAGE = "TARGET_LANGUAGE";
    static final String ENV_TRANSLATION_MODE = "TRANSLATION_MODE";
    static final String ENV_MAX_FILES_PER_RUN = "MAX_FILES_PER_RUN";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_LATEX_EXTENSIONS = "LATEX_EXTENSIONS";
    static final String ENV_LATEX_ENGINE = "LATEX_ENGINE";
    static final String ENV_COMPILE_TIMEOUT_SECONDS = "COMPILE_TIMEOUT_SECONDS";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_LLM_MAX_RETRY_ATTEMPTS = "LLM_MAX_RETRY_ATTEMPTS";
    static final String ENV_LLM_INITIAL_BACKOFF_SECONDS = "LLM_INITIAL_BACKOFF_SECONDS";
    static final String ENV_LLM_MAX_BACKOFF_SECONDS = "LLM_MAX_BACKOFF_SECONDS";
    static final String ENV_LLM_RETRY_JITTER_FACTOR = "LLM_RETRY_JITTER_FACTOR";

    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final Set<String> DEFAULT_LATEX_EXTENSIONS = Set.of("tex", "latex");
    private static final int DEFAULT_LLM_MAX_RETRY_ATTEMPTS = 6;
    private static final int DEFAULT_LLM_INITIAL_BACKOFF_SECONDS = 2;
    private static final int DEFAULT_LLM_MAX_BACKOFF_SECONDS = 60;
    private static final double DEFAULT_LLM_RETRY_JITTER_FACTOR = 0.3;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Mode mode = resolveMode(arguments);
        Path projectRoot = resolveProjectRoot(arguments);
        TargetLanguage targetLanguage = resolveTargetLanguage(arguments);
        TranslationMode translationMode = resolveTranslationMode(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);
        Optional<Path> outputDirectory = resolveOutputDirectory(arguments, mode, projectRoot, targetLanguage);

        Optional<String> geminiApiKey = environmentReader.value(ENV_GEMINI_API_KEY);

        LlmProvider provider = environmentReader.value(ENV_LLM_PROVIDER)
                .map(LlmProvider::from)
                .orElse(LlmProvider.OLLAMA);

        String modelName = environmentReader.value(ENV_LLM_MODEL)
                .orElse(provider.defaultModel());

        Optional<String> baseUrl = Optional.empty();
        if (provider == LlmProvider.OLLAMA) {
            String value = environmentReader.value(ENV_OLLAMA_BASE_URL)
                    .orElse(DEFAULT_OLLAMA_BASE_URL);
            baseUrl = Optional.of(value);
        }

        Set<String> latexExtensions = environmentReader.value(ENV_LATEX_EXTENSIONS)
                .map(ConfigLoader::parseExtensions)
                .orElse(DEFAULT_LATEX_EXTENSIONS);

        LatexEngine engine = resolveEngine(arguments);
        Duration compileTimeout = resolveCompileTimeout(arguments);
        int maxFilesPerRun = resolveMaxFilesPerRun(arguments);

        int llmMaxRetryAttempts = environmentReader.value(ENV_LLM_MAX_RETRY_ATTEMPTS)
                .map(raw -> parsePositiveInteger(raw, ENV_LLM_MAX_RETRY_ATTEMPTS))
                .orElse(DEFAULT_LLM_MAX_RETRY_ATTEMPTS);

        int llmInitialBackoffSeconds = environmentReader.value(ENV_LLM_INITIAL_BACKOFF_SECONDS)
                .map(raw -> parsePositiveInteger(raw, ENV_LLM_INITIAL_BACKOFF_SECONDS))
                .orElse(DEFAULT_LLM_INITIAL_BACKOFF_SECONDS);

        int llmMaxBackoffSeconds = environmentReader.value(ENV_LLM_MAX_BACKOFF_SECONDS)
                .map(raw -> parsePositiveInteger(raw, ENV_LLM_MAX_BACKOFF_SECONDS))
                .orElse(DEFAULT_LLM_MAX_BACKOFF_SECONDS);

        double llmRetryJitterFactor = environmentReader.value(ENV_LLM_RETRY_JITTER_FACTOR)
                .map(ConfigLoader::parseDouble)
                .orElse(DEFAULT_LLM_RETRY_JITTER_FACTOR);

        if (mode.isTranslate() && translationMode == TranslationMode.PRODUCTION
                && provider == LlmProvider.GEMINI && geminiApiKey.isEmpty()) {
            throw new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini");
        }

        Secrets secrets = new Secrets(geminiApiKey);
        TranslatorConfig translatorConfig = new TranslatorConfig(provider, modelName, baseUrl);

        return new Config(mode, projectRoot, outputDirectory, targetLanguage, translationMode, logFormat,
                translatorConfig, secrets, latexExtensions, engine, compileTimeout, arguments.autoFix(),
                arguments.compile(), arguments.bibtex(), maxFilesPerRun,
                llmMaxRetryAttempts, llmInitialBackoffSeconds, llmMaxBackoffSeconds, llmRetryJitterFactor);
    }

    private Mode resolveMode(CliArguments arguments) {
        Mode cliMode = arguments.mode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.value(ENV_MODE)
                .map(Mode::from)
                .orElse(Mode.VALIDATE);
    }

    private Path resolveProjectRoot(CliArguments arguments) {
        Path root = arguments.projectRoot();
        if (root == null) {
            throw new IllegalArgumentException("project root must be provided");
        }
        return root.toAbsolutePath().normalize();
    }

    private TargetLanguage resolveTargetLanguage(CliArguments arguments) {
        TargetLanguage cliLanguage = arguments.targetLanguage();
        if (cliLanguage != null) {
            return cliLanguage;
        }
        return environmentReader.value(ENV_TARGET_LANGUAGE)
                .map(TargetLanguage::from)
                .orElse(TargetLanguage.JAPANESE);
    }

    private TranslationMode resolveTranslationMode(CliArguments arguments) {
        TranslationMode cliMode = arguments.translationMode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.value(ENV_TRANSLATION_MODE)
                .map(TranslationMode::from)
                .orElse(TranslationMode.PRODUCTION);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.value(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    /**
     * Translate runs always write somewhere: next to the project root, suffixed with the language code,
     * unless {@code --output} says otherwise.
     */
    private Optional<Path> resolveOutputDirectory(CliArguments arguments, Mode mode, Path projectRoot,
                                                  TargetLanguage language) {
        Path output = arguments.outputDirectory();
        if (output != null) {
            return Optional.of(output.toAbsolutePath().normalize());
        }
        if (!mode.isTranslate()) {
            return Optional.empty();
        }
        Path name = projectRoot.getFileName();
        String base = name == null ? "latex-project" : name.toString();
        return Optional.of(projectRoot.resolveSibling(base + "-" + language.code()));
    }

    private LatexEngine resolveEngine(CliArguments arguments) {
        LatexEngine cliEngine = arguments.engine();
        if (cliEngine != null) {
            return cliEngine;
        }
        return environmentReader.value(ENV_LATEX_ENGINE)
                .map(LatexEngine::from)
                .orElse(LatexEngine.PDFLATEX);
    }

    private Duration resolveCompileTimeout(CliArguments arguments) {
        Integer seconds = arguments.compileTimeoutSeconds();
        if (seconds == null) {
            return environmentReader.value(ENV_COMPILE_TIMEOUT_SECONDS)
                    .map(raw -> parsePositiveInteger(raw, ENV_COMPILE_TIMEOUT_SECONDS))
                    .filter(value -> value > 0)
                    .map(Duration::ofSeconds)
                    .orElse(CompileSetting.DEFAULT_TIMEOUT);
        }
        if (seconds <= 0) {
            throw new IllegalArgumentException("--compile-timeout must be greater than zero");
        }
        return Duration.ofSeconds(seconds);
    }

    private int resolveMaxFilesPerRun(CliArguments arguments) {
        Integer limit = arguments.translationLimit();
        if (limit == null) {
            return environmentReader.value(ENV_MAX_FILES_PER_RUN)
                    .map(raw -> parsePositiveInteger(raw, ENV_MAX_FILES_PER_RUN))
                    .orElse(0);
        }
        if (limit < 0) {
            throw new IllegalArgumentException("--limit must be zero or greater");
        }
        return limit;
    }

    private static int parsePositiveInteger(String raw, String key) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 0) {
                throw new IllegalArgumentException(key + " must be zero or greater");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static Set<String> parseExtensions(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .map(value -> value.startsWith(".") ? value.substring(1) : value)
                .map(value -> value.toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static double parseDouble(String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid double value: " + raw, ex);
        }
    }
}
