package ai.latex.translator.translate;

import java.util.Objects;

/**
 * Result of translating a single LaTeX file.
 *
 * @param translatedSpans spans replaced by a translation
 * @param keptSpans spans left in the source language after a failure or a blank answer
 */
public record TranslationResult(String filePath, String content, int translatedSpans, int keptSpans) {

    public TranslationResult {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(content, "content");
        if (translatedSpans < 0 || keptSpans < 0) {
            throw new IllegalArgumentException("Span counts must not be negative");
        }
    }
}
