package ai.latex.translator.project;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Result of one analysis run over a project. File contents may be patched by later passes through
 * {@link #applyContent(Map)}; the derived facts keep describing the analyzed content.
 */
public record ProjectModel(
        Path root,
        Optional<String> mainFile,
        MainFileSelection mainFileSelection,
        Map<String, LatexFile> files,
        Map<String, CommandDefinition> globalCommands,
        Map<String, EnvironmentDefinition> globalEnvironments,
        DependencyGraph dependencyGraph,
        CompilationPlan compilationPlan,
        List<FileReadFailure> readFailures
) {

    public ProjectModel {
        Objects.requireNonNull(root, "root");
        mainFile = mainFile == null ? Optional.empty() : mainFile;
        Objects.requireNonNull(mainFileSelection, "mainFileSelection");
        files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
        globalCommands = Collections.unmodifiableMap(new LinkedHashMap<>(globalCommands));
        globalEnvironments = Collections.unmodifiableMap(new LinkedHashMap<>(globalEnvironments));
        Objects.requireNonNull(dependencyGraph, "dependencyGraph");
        Objects.requireNonNull(compilationPlan, "compilationPlan");
        readFailures = List.copyOf(readFailures);
    }

    public Optional<LatexFile> file(String path) {
        return Optional.ofNullable(files.get(path));
    }

    public Optional<LatexFile> mainLatexFile() {
        return mainFile.map(files::get);
    }

    public List<String> compilationOrder() {
        return compilationPlan.order();
    }

    public List<List<String>> cycles() {
        return compilationPlan.cycles();
    }

    /**
     * Every label defined anywhere in the project.
     */
    public Set<String> allLabels() {
        Set<String> labels = new LinkedHashSet<>();
        files.values().forEach(file -> labels.addAll(file.labels()));
        return labels;
    }

    /**
     * Replaces the content of the named files. Paths unknown to the model are ignored.
     */
    public void applyContent(Map<String, String> contents) {
        contents.forEach((path, content) -> {
            LatexFile file = files.get(path);
            if (file != null) {
                file.replaceContent(content);
            }
        });
    }

    public void restoreContent() {
        files.values().forEach(LatexFile::restoreContent);
    }

    /**
     * Current content of every file, in discovery order.
     */
    public Map<String, String> contents() {
        Map<String, String> contents = new LinkedHashMap<>();
        files.forEach((path, file) -> contents.put(path, file.content()));
        return contents;
    }

    public ProjectStructure structure() {
        return new ProjectStructure(files.size(), mainFile, globalCommands.size(), globalEnvironments.size(),
                dependencyGraph.maxDirectDependencies());
    }

    /**
     * Project knowledge relevant to translating one file, or empty for an unknown path.
     */
    public Optional<TranslationContext> translationContext(String path) {
        LatexFile file = files.get(path);
        if (file == null) {
            return Optional.empty();
        }
        Set<String> commands = new TreeSet<>(LatexVocabulary.STANDARD_COMMANDS);
        commands.addAll(globalCommands.keySet());
        Set<String> environments = new TreeSet<>(LatexVocabulary.STANDARD_ENVIRONMENTS);
        environments.addAll(globalEnvironments.keySet());

        Map<String, String> customCommands = new LinkedHashMap<>();
        file.customCommands().forEach((name, definition) -> customCommands.put(name, definition.definition()));
        Map<String, String> customEnvironments = new LinkedHashMap<>();
        file.customEnvironments().forEach((name, definition) -> customEnvironments.put(name, definition.definition()));

        return Optional.of(new TranslationContext(path, mainFile.map(path::equals).orElse(false),
                file.dependencies(), commands, environments, customCommands, customEnvironments,
                file.usedCommands(), file.usedEnvironments(), file.labels(), file.citations(), file.refs()));
    }
}
