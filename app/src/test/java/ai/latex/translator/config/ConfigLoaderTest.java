package ai.latex.translator.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.latex.translator.cli.CliArguments;
import ai.latex.translator.compile.LatexEngine;
import ai.latex.translator.translate.TargetLanguage;
import ai.latex.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "/work/paper",
                "--mode", "translate",
                "--output", "/work/out",
                "--target-language", "en",
                "--translation-mode", "mock",
                "--limit", "5",
                "--auto-fix",
                "--compile",
                "--bibtex",
                "--engine", "xelatex",
                "--compile-timeout", "30",
                "--log-format", "json");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.TRANSLATE);
        assertThat(config.projectRoot()).isEqualTo(Path.of("/work/paper").toAbsolutePath());
        assertThat(config.outputDirectory()).contains(Path.of("/work/out").toAbsolutePath());
        assertThat(config.targetLanguage()).isEqualTo(TargetLanguage.ENGLISH);
        assertThat(config.translationMode()).isEqualTo(TranslationMode.MOCK);
        assertThat(config.maxFilesPerRun()).isEqualTo(5);
        assertThat(config.autoFix()).isTrue();
        assertThat(config.compile()).isTrue();
        assertThat(config.useBibtex()).isTrue();
        assertThat(config.engine()).isEqualTo(LatexEngine.XELATEX);
        assertThat(config.compileTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.translatorConfig().provider()).isEqualTo(LlmProvider.OLLAMA);
        assertThat(config.translatorConfig().modelName()).isEqualTo(LlmProvider.OLLAMA.defaultModel());
        assertThat(config.translatorConfig().baseUrl()).contains("http://localhost:11434");
        assertThat(config.secrets().geminiApiKey()).isEmpty();
        assertThat(config.latexExtensions()).containsExactlyInAnyOrder("tex", "latex");
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_MODE, "validate");
        envValues.put(ConfigLoader.ENV_TARGET_LANGUAGE, "ko");
        envValues.put(ConfigLoader.ENV_TRANSLATION_MODE, "dry-run");
        envValues.put(ConfigLoader.ENV_MAX_FILES_PER_RUN, "2");
        envValues.put(ConfigLoader.ENV_OLLAMA_BASE_URL, "http://ollama:11434");
        envValues.put(ConfigLoader.ENV_LLM_MODEL, "custom-gguf");
        envValues.put(ConfigLoader.ENV_LATEX_EXTENSIONS, ".tex,.ltx");
        envValues.put(ConfigLoader.ENV_LATEX_ENGINE, "lualatex");
        envValues.put(ConfigLoader.ENV_COMPILE_TIMEOUT_SECONDS, "90");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "json");
        envValues.put(ConfigLoader.ENV_LLM_MAX_RETRY_ATTEMPTS, "4");
        envValues.put(ConfigLoader.ENV_LLM_RETRY_JITTER_FACTOR, "0.5");
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(envValues);
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "paper");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.VALIDATE);
        assertThat(config.projectRoot().isAbsolute()).isTrue();
        assertThat(config.projectRoot().getFileName()).isEqualTo(Path.of("paper"));
        assertThat(config.outputDirectory()).isEmpty();
        assertThat(config.targetLanguage()).isEqualTo(TargetLanguage.KOREAN);
        assertThat(config.translationMode()).isEqualTo(TranslationMode.DRY_RUN);
        assertThat(config.maxFilesPerRun()).isEqualTo(2);
        assertThat(config.translatorConfig().baseUrl()).contains("http://ollama:11434");
        assertThat(config.translatorConfig().modelName()).isEqualTo("custom-gguf");
        assertThat(config.latexExtensions()).containsExactlyInAnyOrder("tex", "ltx");
        assertThat(config.engine()).isEqualTo(LatexEngine.LUALATEX);
        assertThat(config.compileTimeout()).isEqualTo(Duration.ofSeconds(90));
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.llmMaxRetryAttempts()).isEqualTo(4);
        assertThat(config.llmRetryJitterFactor()).isEqualTo(0.5);
        assertThat(environmentReader.requestedKeys()).contains(ConfigLoader.ENV_GEMINI_API_KEY);
    }

    @Test
    void cliValuesWinOverEnvironment() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_MODE, "translate",
                ConfigLoader.ENV_TARGET_LANGUAGE, "zh"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "paper", "--mode", "analyze", "--target-language", "ja");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.ANALYZE);
        assertThat(config.targetLanguage()).isEqualTo(TargetLanguage.JAPANESE);
    }

    @Test
    void translateModeDefaultsOutputToSiblingDirectory() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "/work/paper", "--mode", "translate", "--translation-mode", "dry-run");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.outputDirectory()).contains(Path.of("/work/paper-ja").toAbsolutePath());
    }

    @Test
    void missingGeminiKeyForProductionTranslationThrows() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_LLM_PROVIDER, "gemini"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "paper", "--mode", "translate");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(environmentReader).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("GEMINI_API_KEY");
    }

    @Test
    void geminiKeyIsOnlyRequiredForProductionTranslation() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_LLM_PROVIDER, "gemini"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "paper", "--mode", "validate");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.translatorConfig().provider()).isEqualTo(LlmProvider.GEMINI);
        assertThat(config.translatorConfig().baseUrl()).isEmpty();
        assertThat(config.secrets().toString()).doesNotContain("****");
    }

    @Test
    void geminiKeyIsMaskedInToString() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_LLM_PROVIDER, "gemini",
                ConfigLoader.ENV_GEMINI_API_KEY, "secret-key"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "paper", "--mode", "translate");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.secrets().geminiApiKey()).contains("secret-key");
        assertThat(config.secrets().toString()).doesNotContain("secret-key");
    }

    @Test
    void rejectsInvalidNumbers() {
        CliArguments negativeLimit = CommandLine.populateCommand(new CliArguments(), "paper", "--limit=-1");
        CliArguments zeroTimeout = CommandLine.populateCommand(new CliArguments(), "paper", "--compile-timeout", "0");
        RecordingEnvironmentReader badEnvironment = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_MAX_FILES_PER_RUN, "many"));

        assertThat(catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(negativeLimit)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--limit");
        assertThat(catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(zeroTimeout)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--compile-timeout");
        assertThat(catchThrowable(() -> new ConfigLoader(badEnvironment)
                .load(CommandLine.populateCommand(new CliArguments(), "paper"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_MAX_FILES_PER_RUN);
    }

    @Test
    void blankEnvironmentValuesKeepDefaultsAndOthersAreTrimmed() {
        Map<String, String> envValues = Map.of(
                ConfigLoader.ENV_LATEX_ENGINE, "   ",
                ConfigLoader.ENV_LLM_MODEL, "",
                ConfigLoader.ENV_OLLAMA_BASE_URL, " http://gpu-box:11434 \n",
                ConfigLoader.ENV_COMPILE_TIMEOUT_SECONDS, " 45 ");

        Config config = new ConfigLoader(key -> Optional.ofNullable(envValues.get(key)))
                .load(CommandLine.populateCommand(new CliArguments(), "paper"));

        assertThat(config.engine()).isEqualTo(LatexEngine.PDFLATEX);
        assertThat(config.compileTimeout()).isEqualTo(Duration.ofSeconds(45));
        assertThat(config.translatorConfig().modelName()).isEqualTo(LlmProvider.OLLAMA.defaultModel());
        assertThat(config.translatorConfig().describe())
                .isEqualTo("ollama model '" + LlmProvider.OLLAMA.defaultModel() + "' via http://gpu-box:11434");
    }

    @Test
    void translatorConfigFallsBackToProviderDefaultModel() {
        TranslatorConfig gemini = new TranslatorConfig(LlmProvider.GEMINI, " ", null);

        assertThat(gemini.modelName()).isEqualTo(LlmProvider.GEMINI.defaultModel());
        assertThat(gemini.baseUrl()).isEmpty();
        assertThat(gemini.describe()).isEqualTo("gemini model '" + LlmProvider.GEMINI.defaultModel() + "'");
    }

    private static final class RecordingEnvironmentReader implements EnvironmentReader {

        private final Map<String, String> values;
        private final List<String> requestedKeys = new ArrayList<>();

        private RecordingEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            requestedKeys.add(key);
            return Optional.ofNullable(values.get(key));
        }

        List<String> requestedKeys() {
            return requestedKeys;
        }
    }
}
