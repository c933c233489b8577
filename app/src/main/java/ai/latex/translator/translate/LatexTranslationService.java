package ai.latex.translator.translate;

import ai.latex.translator.parser.LatexParser;
import ai.latex.translator.parser.SectionSlice;
import ai.latex.translator.parser.TextReplacement;
import ai.latex.translator.project.LatexFile;
import ai.latex.translator.project.LatexProjectAnalyzer;
import ai.latex.translator.project.ProjectModel;
import dev.langchain4j.exception.RateLimitException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Translates LaTeX files span by span so that only natural-language text reaches the translator and
 * every command, math fragment and comment is copied through unchanged.
 */
public class LatexTranslationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(LatexTranslationService.class);
    private static final Pattern RETRY_DELAY_PATTERN = Pattern.compile("(?:retry in |retryDelay\"?:\\s*\")([0-9]+(?:\\.[0-9]+)?)s", Pattern.CASE_INSENSITIVE);

    private final TranslatorFactory translatorFactory;
    private final LatexParser parser;
    private final int maxRetryAttempts;
    private final int initialBackoffSeconds;
    private final int maxBackoffSeconds;
    private final double jitterFactor;

    public LatexTranslationService(TranslatorFactory translatorFactory, LatexParser parser) {
        this(translatorFactory, parser, 6, 2, 60, 0.3);
    }

    public LatexTranslationService(TranslatorFactory translatorFactory, LatexParser parser,
                                   int maxRetryAttempts, int initialBackoffSeconds, int maxBackoffSeconds, double jitterFactor) {
        this.translatorFactory = Objects.requireNonNull(translatorFactory, "translatorFactory");
        this.parser = Objects.requireNonNull(parser, "parser");
        if (maxRetryAttempts < 1) {
            throw new IllegalArgumentException("maxRetryAttempts must be at least 1");
        }
        if (initialBackoffSeconds < 1) {
            throw new IllegalArgumentException("initialBackoffSeconds must be at least 1");
        }
        if (maxBackoffSeconds < initialBackoffSeconds) {
            throw new IllegalArgumentException("maxBackoffSeconds must be at least initialBackoffSeconds");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
        }
        this.maxRetryAttempts = maxRetryAttempts;
        this.initialBackoffSeconds = initialBackoffSeconds;
        this.maxBackoffSeconds = maxBackoffSeconds;
        this.jitterFactor = jitterFactor;
    }

    /**
     * Translates the current content of every file in compilation order. A limit of zero means no limit.
     */
    public TranslationOutcome translateProject(ProjectModel model, TargetLanguage language, TranslationMode mode,
                                               int maxFiles) {
        Objects.requireNonNull(model, "model");
        if (maxFiles < 0) {
            throw new IllegalArgumentException("maxFiles must be zero or greater");
        }
        List<String> order = model.compilationOrder();
        if (maxFiles > 0 && order.size() > maxFiles) {
            LOGGER.info("Limiting translation to {} of {} files", maxFiles, order.size());
            order = order.subList(0, maxFiles);
        }
        List<TranslationResult> results = new ArrayList<>();
        List<String> failedFiles = new ArrayList<>();
        for (String path : order) {
            LatexFile file = model.files().get(path);
            if (file == null) {
                continue;
            }
            try {
                results.add(translateFile(path, file.content(), language, mode));
            } catch (TranslationException ex) {
                LOGGER.error("Translation failed for {}: {}", ex.latexFile().orElse(path), ex.getMessage(), ex);
                failedFiles.add(path);
            }
        }
        return new TranslationOutcome(results, failedFiles);
    }

    /**
     * Translates one file section by section. A span whose translation fails with a rate limit after
     * every retry, or comes back blank, keeps its source text; any other translator failure fails the file.
     */
    public TranslationResult translateFile(String path, String content, TargetLanguage language, TranslationMode mode) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(language, "language");
        Translator translator = translatorFactory.select(mode);
        MDC.put(LatexProjectAnalyzer.MDC_FILE, path);
        try {
            LOGGER.info("Starting translation of {}", path);
            StringBuilder output = new StringBuilder(content == null ? 0 : content.length());
            int translated = 0;
            int kept = 0;
            List<SectionSlice> sections = parser.splitBySections(content);
            for (int i = 0; i < sections.size(); i++) {
                SectionSlice section = sections.get(i);
                if (section.text().isBlank()) {
                    output.append(section.text());
                    continue;
                }
                LOGGER.debug("Translating section {} of {}: {}", i, path, section.isPreamble() ? "(preamble)" : section.heading());
                SpanCounts counts = new SpanCounts();
                output.append(translateSection(section, translator, language, counts));
                translated += counts.translated;
                kept += counts.kept;
            }
            LOGGER.info("Translated {} spans of {} ({} kept in the source language)", translated, path, kept);
            return new TranslationResult(path, output.toString(), translated, kept);
        } catch (TranslationException ex) {
            throw ex.inFile(path);
        } finally {
            MDC.remove(LatexProjectAnalyzer.MDC_FILE);
        }
    }

    private String translateSection(SectionSlice section, Translator translator, TargetLanguage language,
                                    SpanCounts counts) {
        String text = section.text();
        List<TextReplacement> spans = parser.extractTranslatableSpans(text);
        if (spans.isEmpty()) {
            return text;
        }
        String context = section.isPreamble() ? "" : "Section: " + section.heading();
        List<TextReplacement> replacements = new ArrayList<>(spans.size());
        for (TextReplacement span : spans) {
            replacements.add(span.withText(translateSpan(span.text(),
                    core -> translator.translate(core, language, context), counts)));
        }
        return parser.preserveStructure(text, replacements);
    }

    /**
     * Translates the trimmed core of a span and restores its surrounding whitespace.
     */
    private String translateSpan(String span, UnaryOperator<String> call, SpanCounts counts) {
        int start = 0;
        while (start < span.length() && Character.isWhitespace(span.charAt(start))) {
            start++;
        }
        int end = span.length();
        while (end > start && Character.isWhitespace(span.charAt(end - 1))) {
            end--;
        }
        String core = span.substring(start, end);
        String result;
        try {
            result = translateWithRetry(core, call);
        } catch (TranslationException ex) {
            if (!isRateLimitError(ex)) {
                throw ex;
            }
            LOGGER.warn("Keeping source text for a span after repeated rate limiting");
            counts.kept++;
            return span;
        }
        if (result == null || result.isBlank()) {
            LOGGER.warn("Received blank translation; falling back to source");
            counts.kept++;
            return span;
        }
        counts.translated++;
        return span.substring(0, start) + result.strip() + span.substring(end);
    }

    private String translateWithRetry(String core, UnaryOperator<String> call) {
        TranslationException lastFailure = null;
        for (int attempt = 0; attempt < maxRetryAttempts; attempt++) {
            try {
                return call.apply(core);
            } catch (TranslationException ex) {
                lastFailure = ex;
                Optional<Duration> maybeDelay = calculateRetryDelay(ex, attempt);
                if (maybeDelay.isEmpty() || attempt == maxRetryAttempts - 1) {
                    if (isRateLimitError(ex)) {
                        LOGGER.error("Translation rate limited; max retries ({}) exceeded", maxRetryAttempts);
                    }
                    throw ex;
                }
                Duration delay = maybeDelay.get();
                LOGGER.warn("Translation rate limited (429/RESOURCE_EXHAUSTED); retrying in {} ms (attempt {}/{})",
                        delay.toMillis(), attempt + 1, maxRetryAttempts);
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException interruptedException) {
                    Thread.currentThread().interrupt();
                    LOGGER.warn("Translation retry interrupted");
                    throw ex;
                }
            }
        }
        throw lastFailure == null ? new TranslationException("Unknown translation failure") : lastFailure;
    }

    private Optional<Duration> calculateRetryDelay(Throwable throwable, int attemptNumber) {
        if (!isRateLimitError(throwable)) {
            return Optional.empty();
        }
        Optional<Duration> providerDelay = extractProviderRetryAfter(throwable);
        if (providerDelay.isPresent()) {
            return providerDelay;
        }
        // initialBackoff * 2^attempt, capped, then spread by the jitter factor
        long baseDelaySeconds = initialBackoffSeconds * (1L << Math.min(attemptNumber, 30));
        long cappedDelaySeconds = Math.min(baseDelaySeconds, maxBackoffSeconds);
        double jitterMultiplier = 1.0 + (Math.random() * 2.0 - 1.0) * jitterFactor;
        long finalDelayMillis = Math.max(1000L, (long) (cappedDelaySeconds * 1000L * jitterMultiplier));
        return Optional.of(Duration.ofMillis(finalDelayMillis));
    }

    static boolean isRateLimitError(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof RateLimitException) {
                return true;
            }
            String message = cause.getMessage();
            if (message != null && (message.contains("RESOURCE_EXHAUSTED") || message.contains("429"))) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private Optional<Duration> extractProviderRetryAfter(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            String message = cause.getMessage();
            if (message != null) {
                Matcher matcher = RETRY_DELAY_PATTERN.matcher(message);
                if (matcher.find()) {
                    double seconds = Double.parseDouble(matcher.group(1));
                    return Optional.of(Duration.ofMillis(Math.max(0, (long) (seconds * 1000))));
                }
            }
            cause = cause.getCause();
        }
        return Optional.empty();
    }

    private static final class SpanCounts {
        private int translated;
        private int kept;
    }
}
