package ai.latex.translator.project;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Project knowledge about a single file, handed to translators as guidance.
 */
public record TranslationContext(
        String filePath,
        boolean mainFile,
        List<String> dependencies,
        Set<String> availableCommands,
        Set<String> availableEnvironments,
        Map<String, String> customCommands,
        Map<String, String> customEnvironments,
        Set<String> usedCommands,
        Set<String> usedEnvironments,
        Set<String> labels,
        Set<String> citations,
        Set<String> refs
) {

    public TranslationContext {
        Objects.requireNonNull(filePath, "filePath");
        dependencies = List.copyOf(dependencies);
        availableCommands = Set.copyOf(availableCommands);
        availableEnvironments = Set.copyOf(availableEnvironments);
        customCommands = Map.copyOf(customCommands);
        customEnvironments = Map.copyOf(customEnvironments);
        usedCommands = Set.copyOf(usedCommands);
        usedEnvironments = Set.copyOf(usedEnvironments);
        labels = Set.copyOf(labels);
        citations = Set.copyOf(citations);
        refs = Set.copyOf(refs);
    }
}
