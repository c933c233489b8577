package ai.latex.translator.project;

import ai.latex.translator.parser.LatexElement;
import ai.latex.translator.parser.LatexParser;
import ai.latex.translator.parser.LatexSyntax;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Builds a {@link ProjectModel} from a directory of LaTeX sources: file discovery, main file selection,
 * per-file facts, custom definitions, dependency graph and compilation order.
 */
public class LatexProjectAnalyzer {

    public static final String MDC_FILE = "latexFile";
    public static final Set<String> DEFAULT_EXTENSIONS = Set.of("tex", "latex");
    public static final List<String> CONVENTIONAL_MAIN_FILES = List.of(
            "main.tex", "paper.tex", "document.tex", "thesis.tex", "article.tex");

    private static final Logger LOGGER = LoggerFactory.getLogger(LatexProjectAnalyzer.class);
    private static final Pattern DEPENDENCY = Pattern.compile("\\\\(input|include|subfile|InputIfFileExists)\\s*\\{([^{}]+)\\}");
    private static final Pattern DOCUMENT_CLASS = Pattern.compile("\\\\documentclass(?![a-zA-Z])");

    private final LatexParser parser;
    private final CustomDefinitionScanner definitionScanner = new CustomDefinitionScanner();
    private final Set<String> extensions;

    public LatexProjectAnalyzer() {
        this(new LatexParser(), DEFAULT_EXTENSIONS);
    }

    public LatexProjectAnalyzer(LatexParser parser, Set<String> extensions) {
        this.parser = Objects.requireNonNull(parser, "parser");
        Objects.requireNonNull(extensions, "extensions");
        if (extensions.isEmpty()) {
            throw new IllegalArgumentException("At least one LaTeX file extension is required");
        }
        this.extensions = extensions.stream()
                .map(extension -> extension.startsWith(".") ? extension.substring(1) : extension)
                .map(extension -> extension.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public ProjectModel analyze(Path root) {
        Objects.requireNonNull(root, "root");
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Project root is not a directory: " + root);
        }
        LOGGER.info("Starting LaTeX project analysis in {}", root);
        List<String> paths = discover(root);
        LOGGER.info("Found {} LaTeX files", paths.size());

        Map<String, String> contents = new LinkedHashMap<>();
        List<FileReadFailure> failures = new ArrayList<>();
        for (String path : paths) {
            try {
                contents.put(path, Files.readString(root.resolve(path), StandardCharsets.UTF_8));
            } catch (IOException ex) {
                LOGGER.warn("Could not read {}: {}", path, ex.toString());
                failures.add(new FileReadFailure(path, ex.toString()));
                contents.put(path, "");
            }
        }
        return analyzeContents(root, contents, failures);
    }

    /**
     * Analyzes a single in-memory file as a one-file project rooted at the file's directory.
     */
    public ProjectModel analyzeSingle(String path, String content) {
        Objects.requireNonNull(path, "path");
        Path file = Path.of(path).toAbsolutePath().normalize();
        Path parent = file.getParent();
        Map<String, String> contents = new LinkedHashMap<>();
        contents.put(normalizePath(file.getFileName().toString()), content == null ? "" : content);
        return analyzeContents(parent == null ? Path.of("").toAbsolutePath() : parent, contents, List.of());
    }

    /**
     * Analyzes the current content of {@code model} again, for instance after fixes or translations were
     * applied. The new model treats that content as its original content.
     */
    public ProjectModel reanalyze(ProjectModel model) {
        Objects.requireNonNull(model, "model");
        return analyzeContents(model.root(), model.contents(), model.readFailures());
    }

    ProjectModel analyzeContents(Path root, Map<String, String> contents, List<FileReadFailure> failures) {
        MainFileSelection selection = MainFileSelection.NONE;
        Optional<String> mainFile = Optional.empty();
        Optional<String> conventional = CONVENTIONAL_MAIN_FILES.stream().filter(contents::containsKey).findFirst();
        if (conventional.isPresent()) {
            mainFile = conventional;
            selection = MainFileSelection.CONVENTIONAL_NAME;
        } else {
            Optional<String> withClass = contents.entrySet().stream()
                    .filter(entry -> DOCUMENT_CLASS.matcher(LatexSyntax.maskComments(entry.getValue())).find())
                    .map(Map.Entry::getKey)
                    .findFirst();
            if (withClass.isPresent()) {
                mainFile = withClass;
                selection = MainFileSelection.DOCUMENT_CLASS;
            } else if (!contents.isEmpty()) {
                mainFile = Optional.of(contents.keySet().iterator().next());
                selection = MainFileSelection.FALLBACK;
                LOGGER.warn("No conventional main file and no \\documentclass found; using {}", mainFile.get());
            }
        }
        mainFile.ifPresent(main -> LOGGER.info("Main file: {}", main));

        Map<String, LatexFile> files = new LinkedHashMap<>();
        contents.forEach((path, content) -> files.put(path, analyzeFile(root, path, content)));

        DependencyGraph graph = DependencyGraph.build(files);
        CompilationPlan plan = graph.compilationPlan();
        for (List<String> cycle : plan.cycles()) {
            LOGGER.warn("Circular dependency: {}", String.join(" -> ", cycle));
        }

        Map<String, CommandDefinition> globalCommands = new LinkedHashMap<>();
        Map<String, EnvironmentDefinition> globalEnvironments = new LinkedHashMap<>();
        for (LatexFile file : files.values()) {
            file.customCommands().forEach((name, definition) -> {
                CommandDefinition previous = globalCommands.put(name, definition);
                if (previous != null && !previous.sourceFile().equals(definition.sourceFile())) {
                    LOGGER.debug("Command \\{} from {} overrides the definition in {}", name,
                            definition.sourceFile(), previous.sourceFile());
                }
            });
            globalEnvironments.putAll(file.customEnvironments());
        }

        ProjectModel model = new ProjectModel(root, mainFile, selection, files, globalCommands, globalEnvironments,
                graph, plan, failures);
        LOGGER.info("Project analysis completed: {} files, {} custom commands, {} custom environments",
                files.size(), globalCommands.size(), globalEnvironments.size());
        return model;
    }

    private LatexFile analyzeFile(Path root, String path, String content) {
        MDC.put(MDC_FILE, path);
        try {
            LatexFile file = new LatexFile(path, content);
            recordElements(parser.parse(content), file);

            String code = LatexSyntax.maskComments(content);
            Matcher matcher = DEPENDENCY.matcher(code);
            while (matcher.find()) {
                if (!LatexSyntax.isEscaped(code, matcher.start())) {
                    recordDependency(root, file, matcher.group(2));
                }
            }
            definitionScanner.commands(code, path).forEach(file::defineCommand);
            definitionScanner.environments(code, path).forEach(file::defineEnvironment);
            LOGGER.debug("Analyzed {}: {} dependencies, {} commands used, {} labels", path,
                    file.dependencies().size(), file.usedCommands().size(), file.labels().size());
            return file;
        } finally {
            MDC.remove(MDC_FILE);
        }
    }

    private void recordElements(List<LatexElement> elements, LatexFile file) {
        for (LatexElement element : elements) {
            switch (element.kind()) {
                case COMMAND -> {
                    element.name().ifPresent(file::recordCommand);
                    recordElements(parser.parseNested(element), file);
                }
                case ENVIRONMENT -> {
                    element.name().ifPresent(file::recordEnvironment);
                    recordElements(parser.parseNested(element), file);
                }
                case MATH_INLINE, MATH_DISPLAY -> recordElements(parser.parseNested(element), file);
                case CITATION -> element.metadata(LatexElement.META_KEYS).ifPresent(keys -> {
                    for (String key : keys.split(",")) {
                        if (!key.isBlank()) {
                            file.recordCitation(key.strip());
                        }
                    }
                });
                case REFERENCE -> element.metadata(LatexElement.META_KEY)
                        .filter(key -> !key.isBlank())
                        .ifPresent(file::recordRef);
                case LABEL -> element.metadata(LatexElement.META_KEY)
                        .filter(key -> !key.isBlank())
                        .ifPresent(file::recordLabel);
                default -> {
                }
            }
        }
    }

    private void recordDependency(Path root, LatexFile file, String target) {
        String normalized = normalizePath(target.strip());
        if (normalized.isEmpty()) {
            return;
        }
        String fileName = normalized.substring(normalized.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            file.addDependency(normalized + ".tex");
        } else if (extensions.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT))) {
            file.addDependency(normalized);
        } else if (Files.isRegularFile(root.resolve(normalized))) {
            file.addAssetInput(normalized);
        } else {
            file.addDependency(normalized);
        }
    }

    private List<String> discover(Path root) {
        try (Stream<Path> stream = Files.walk(root)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(this::hasLatexExtension)
                    .map(path -> normalizePath(root.relativize(path).toString()))
                    .filter(path -> !path.startsWith(".git/"))
                    .sorted()
                    .toList();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to scan project directory: " + root, ex);
        }
    }

    private boolean hasLatexExtension(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && extensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    static String normalizePath(String path) {
        String normalized = path.replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return normalized;
    }
}
