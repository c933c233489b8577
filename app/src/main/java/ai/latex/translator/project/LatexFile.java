package ai.latex.translator.project;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One source file of an analyzed project. The content may be replaced by a fix or translation pass;
 * everything else reflects the content read at analysis time.
 */
public final class LatexFile {

    private final String path;
    private final String originalContent;
    private String content;
    private final List<String> dependencies = new ArrayList<>();
    private final Set<String> assetInputs = new LinkedHashSet<>();
    private final Map<String, CommandDefinition> customCommands = new LinkedHashMap<>();
    private final Map<String, EnvironmentDefinition> customEnvironments = new LinkedHashMap<>();
    private final Set<String> usedCommands = new LinkedHashSet<>();
    private final Set<String> usedEnvironments = new LinkedHashSet<>();
    private final Set<String> citations = new LinkedHashSet<>();
    private final Set<String> labels = new LinkedHashSet<>();
    private final Set<String> refs = new LinkedHashSet<>();

    public LatexFile(String path, String content) {
        this.path = Objects.requireNonNull(path, "path");
        this.originalContent = content == null ? "" : content;
        this.content = this.originalContent;
    }

    public String path() {
        return path;
    }

    public String content() {
        return content;
    }

    public String originalContent() {
        return originalContent;
    }

    public void replaceContent(String replacement) {
        this.content = Objects.requireNonNull(replacement, "replacement");
    }

    public void restoreContent() {
        this.content = originalContent;
    }

    public boolean isModified() {
        return !content.equals(originalContent);
    }

    public List<String> lines() {
        return List.of(content.split("\n", -1));
    }

    /**
     * Dependency paths in order of appearance, relative to the project root.
     */
    public List<String> dependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    /**
     * Non-LaTeX files pulled in with {@code \input}, such as {@code .pgf} or {@code .tikz} drawings.
     */
    public Set<String> assetInputs() {
        return Collections.unmodifiableSet(assetInputs);
    }

    public Map<String, CommandDefinition> customCommands() {
        return Collections.unmodifiableMap(customCommands);
    }

    public Map<String, EnvironmentDefinition> customEnvironments() {
        return Collections.unmodifiableMap(customEnvironments);
    }

    public Set<String> usedCommands() {
        return Collections.unmodifiableSet(usedCommands);
    }

    public Set<String> usedEnvironments() {
        return Collections.unmodifiableSet(usedEnvironments);
    }

    public Set<String> citations() {
        return Collections.unmodifiableSet(citations);
    }

    public Set<String> labels() {
        return Collections.unmodifiableSet(labels);
    }

    public Set<String> refs() {
        return Collections.unmodifiableSet(refs);
    }

    void addDependency(String dependency) {
        if (!dependencies.contains(dependency)) {
            dependencies.add(dependency);
        }
    }

    void addAssetInput(String asset) {
        assetInputs.add(asset);
    }

    void defineCommand(CommandDefinition definition) {
        customCommands.put(definition.name(), definition);
    }

    void defineEnvironment(EnvironmentDefinition definition) {
        customEnvironments.put(definition.name(), definition);
    }

    void recordCommand(String name) {
        usedCommands.add(name);
    }

    void recordEnvironment(String name) {
        usedEnvironments.add(name);
    }

    void recordCitation(String key) {
        citations.add(key);
    }

    void recordLabel(String key) {
        labels.add(key);
    }

    void recordRef(String key) {
        refs.add(key);
    }

    @Override
    public String toString() {
        return "LatexFile[" + path + "]";
    }
}
