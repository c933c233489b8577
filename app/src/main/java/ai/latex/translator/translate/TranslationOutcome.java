package ai.latex.translator.translate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate of translation results for a project run.
 */
public record TranslationOutcome(List<TranslationResult> results,
                                 List<String> failedFiles) {

    public TranslationOutcome {
        results = List.copyOf(Objects.requireNonNull(results, "results"));
        failedFiles = List.copyOf(Objects.requireNonNull(failedFiles, "failedFiles"));
    }

    public int processedFiles() {
        return results.size();
    }

    /**
     * Translated content keyed by file path, in translation order.
     */
    public Map<String, String> contents() {
        Map<String, String> contents = new LinkedHashMap<>();
        for (TranslationResult result : results) {
            contents.put(result.filePath(), result.content());
        }
        return contents;
    }
}
