package ai.latex.translator.config;

import ai.latex.translator.compile.LatexEngine;
import ai.latex.translator.translate.TargetLanguage;
import ai.latex.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Mode mode,
        Path projectRoot,
        Optional<Path> outputDirectory,
        TargetLanguage targetLanguage,
        TranslationMode translationMode,
        LogFormat logFormat,
        TranslatorConfig translatorConfig,
        Secrets secrets,
        Set<String> latexExtensions,
        LatexEngine engine,
        Duration compileTimeout,
        boolean autoFix,
        boolean compile,
        boolean useBibtex,
        int maxFilesPerRun,
        int llmMaxRetryAttempts,
        int llmInitialBackoffSeconds,
        int llmMaxBackoffSeconds,
        double llmRetryJitterFactor
) {

    private static final Set<String> DEFAULT_LATEX_EXTENSIONS = Set.of("tex", "latex");

    public Config {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(projectRoot, "projectRoot");
        outputDirectory = outputDirectory == null ? Optional.empty() : outputDirectory;
        targetLanguage = Objects.requireNonNull(targetLanguage, "targetLanguage");
        translationMode = Objects.requireNonNull(translationMode, "translationMode");
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        translatorConfig = Objects.requireNonNull(translatorConfig, "translatorConfig");
        secrets = Objects.requireNonNull(secrets, "secrets");
        latexExtensions = latexExtensions == null || latexExtensions.isEmpty()
                ? DEFAULT_LATEX_EXTENSIONS
                : latexExtensions.stream()
                .map(Config::normalizeExtension)
                .filter(value -> !value.isBlank())
                .collect(Collectors.toUnmodifiableSet());
        engine = Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(compileTimeout, "compileTimeout");
        if (compileTimeout.isZero() || compileTimeout.isNegative()) {
            throw new IllegalArgumentException("compileTimeout must be positive");
        }
        if (maxFilesPerRun < 0) {
            throw new IllegalArgumentException("maxFilesPerRun must be greater than or equal to zero");
        }
    }

    private static String normalizeExtension(String raw) {
        String normalized = raw.trim();
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        return normalized.toLowerCase(Locale.ROOT);
    }
}
