package ai.latex.translator.validate;

import ai.latex.translator.compile.CompileError;
import ai.latex.translator.parser.ElementKind;
import ai.latex.translator.parser.LatexElement;
import ai.latex.translator.parser.LatexParser;
import ai.latex.translator.parser.LatexSyntax;
import ai.latex.translator.project.CommandDefinition;
import ai.latex.translator.project.DependencyGraph;
import ai.latex.translator.project.FileReadFailure;
import ai.latex.translator.project.LatexFile;
import ai.latex.translator.project.LatexProjectAnalyzer;
import ai.latex.translator.project.LatexVocabulary;
import ai.latex.translator.project.MainFileSelection;
import ai.latex.translator.project.ProjectModel;
import ai.latex.translator.project.TranslationContext;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Checks a project model for problems that break or endanger compilation. Every check runs on every
 * call and all findings are aggregated into one report.
 */
public class LatexValidator {

    static final List<String> TRANSLATION_RULES = List.of(
            "Do not change LaTeX commands or environments.",
            "Never change math delimiters or special characters ($, \\(, \\), {, }, \\, &, %).",
            "Keep the keys inside \\cite, \\ref and \\label unchanged.",
            "Do not translate custom commands.",
            "Do not change file names or paths.");

    private static final Logger LOGGER = LoggerFactory.getLogger(LatexValidator.class);
    private static final Pattern DOCUMENT_CLASS = Pattern.compile("\\\\documentclass(?![a-zA-Z])");
    private static final Pattern BEGIN_DOCUMENT = Pattern.compile("\\\\begin\\s*\\{document\\}");
    private static final Pattern END_DOCUMENT = Pattern.compile("\\\\end\\s*\\{document\\}");
    private static final int EXCERPT_LENGTH = 60;

    private final LatexParser parser;
    private final LatexAutoFixer autoFixer;

    public LatexValidator() {
        this(new LatexParser());
    }

    public LatexValidator(LatexParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.autoFixer = new LatexAutoFixer(parser);
    }

    public ValidationReport validate(ProjectModel model) {
        Objects.requireNonNull(model, "model");
        LOGGER.info("Starting LaTeX project validation");
        List<ValidationIssue> issues = new ArrayList<>();
        validateStructure(model, issues);
        for (FileReadFailure failure : model.readFailures()) {
            issues.add(ValidationIssue.warning(IssueKind.UNREADABLE_FILE, failure.path(), 0,
                    "File could not be read: " + failure.message(), "Check the file encoding and permissions"));
        }
        for (LatexFile file : model.files().values()) {
            MDC.put(LatexProjectAnalyzer.MDC_FILE, file.path());
            try {
                validateLines(file, issues);
                List<LatexElement> elements = parser.parse(file.content());
                validateCommands(model, file, elements, issues);
                validateEnvironments(file, elements, issues);
            } finally {
                MDC.remove(LatexProjectAnalyzer.MDC_FILE);
            }
        }
        validateDependencies(model, issues);
        validateReferences(model, issues);
        validateCustomDefinitions(model, issues);

        ValidationReport report = new ValidationReport(issues);
        LOGGER.info("Validation completed: {} errors, {} warnings", report.errorCount(), report.warningCount());
        return report;
    }

    /**
     * Fixed content of every file the auto-fix pass changes. The model itself is not modified.
     */
    public Map<String, String> autoFixIssues(ProjectModel model) {
        return autoFixer.fixProject(model);
    }

    public Optional<SafeTranslationContext> safeContext(ProjectModel model, ValidationReport report, String path) {
        return safeContext(model, report, path, null);
    }

    /**
     * Translation guidance for one file, or empty when the model has no such file.
     */
    public Optional<SafeTranslationContext> safeContext(ProjectModel model, ValidationReport report, String path,
                                                        CompileError compileError) {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(report, "report");
        Optional<TranslationContext> context = model.translationContext(path);
        Optional<LatexFile> file = model.file(path);
        if (context.isEmpty() || file.isEmpty()) {
            return Optional.empty();
        }
        List<String> critical = new ArrayList<>();
        for (String command : file.get().usedCommands()) {
            CommandDefinition definition = model.globalCommands().get(command);
            if (definition != null && !definition.sourceFile().equals(path)) {
                critical.add(command);
            }
        }
        List<String> rules = new ArrayList<>(TRANSLATION_RULES);
        if (!file.get().customCommands().isEmpty()) {
            rules.add("Do not change the custom commands defined in this file: "
                    + String.join(", ", file.get().customCommands().keySet()) + ".");
        }
        if (!file.get().customEnvironments().isEmpty()) {
            rules.add("Do not change the custom environments defined in this file: "
                    + String.join(", ", file.get().customEnvironments().keySet()) + ".");
        }
        Optional<String> compileErrors = Optional.ofNullable(compileError).map(CompileError::message);
        return Optional.of(new SafeTranslationContext(context.get(), report.issuesFor(path), critical, rules,
                compileErrors));
    }

    private void validateStructure(ProjectModel model, List<ValidationIssue> issues) {
        Optional<LatexFile> main = model.mainLatexFile();
        if (main.isEmpty()) {
            issues.add(ValidationIssue.error(IssueKind.MISSING_MAIN_FILE, "", "No main file found",
                    "Create main.tex or a file containing \\documentclass"));
            return;
        }
        String path = main.get().path();
        if (model.mainFileSelection() == MainFileSelection.FALLBACK) {
            issues.add(ValidationIssue.warning(IssueKind.MAIN_FILE_FALLBACK, path, 0,
                    "Main file chosen arbitrarily: " + path, "Name the entry point main.tex or add \\documentclass"));
        }
        String code = LatexSyntax.maskComments(main.get().content());
        if (!DOCUMENT_CLASS.matcher(code).find()) {
            issues.add(ValidationIssue.error(IssueKind.MISSING_DOCUMENTCLASS, path, "\\documentclass not found",
                    "Add \\documentclass{article} or another document class"));
        }
        if (!BEGIN_DOCUMENT.matcher(code).find()) {
            issues.add(ValidationIssue.error(IssueKind.MISSING_BEGIN_DOCUMENT, path, "\\begin{document} not found",
                    "Add \\begin{document}"));
        }
        if (!END_DOCUMENT.matcher(code).find()) {
            issues.add(ValidationIssue.error(IssueKind.MISSING_END_DOCUMENT, path, "\\end{document} not found",
                    "Add \\end{document}"));
        }
    }

    private void validateLines(LatexFile file, List<ValidationIssue> issues) {
        List<String> lines = file.lines();
        for (int i = 0; i < lines.size(); i++) {
            String line = LatexSyntax.stripComment(lines.get(i));
            if (LatexSyntax.countUnescaped(line, '{') != LatexSyntax.countUnescaped(line, '}')) {
                issues.add(ValidationIssue.warning(IssueKind.UNMATCHED_BRACES, file.path(), i + 1,
                        "Unbalanced braces: " + excerpt(line), "Check the number of { and }"));
            }
            if (LatexSyntax.countUnescaped(line, '$') % 2 != 0) {
                issues.add(ValidationIssue.warning(IssueKind.UNMATCHED_MATH_DELIMITERS, file.path(), i + 1,
                        "Unbalanced math delimiters: " + excerpt(line), "Check the number of $"));
            }
        }
    }

    private void validateCommands(ProjectModel model, LatexFile file, List<LatexElement> elements,
                                  List<ValidationIssue> issues) {
        Map<String, Integer> unknown = new LinkedHashMap<>();
        collectUnknownCommands(model, elements, unknown);
        String content = file.content();
        unknown.forEach((name, offset) -> issues.add(ValidationIssue.warning(IssueKind.UNKNOWN_COMMAND, file.path(),
                lineOf(content, offset), "Unknown command: \\" + name,
                "Check the command name and that the package providing it is loaded")));
    }

    private void collectUnknownCommands(ProjectModel model, List<LatexElement> elements, Map<String, Integer> unknown) {
        for (LatexElement element : elements) {
            if (element.kind() == ElementKind.COMMAND) {
                String name = element.name().orElse("");
                if (!name.isEmpty() && !LatexVocabulary.isKnownCommand(name)
                        && !model.globalCommands().containsKey(name)) {
                    unknown.putIfAbsent(name, element.start());
                }
            }
            if (element.kind() == ElementKind.COMMAND || element.kind() == ElementKind.ENVIRONMENT
                    || element.kind().isMath()) {
                collectUnknownCommands(model, parser.parseNested(element), unknown);
            }
        }
    }

    private void validateEnvironments(LatexFile file, List<LatexElement> elements, List<ValidationIssue> issues) {
        Deque<String> stack = new ArrayDeque<>();
        String content = file.content();
        for (LatexElement element : elements) {
            if (element.kind() != ElementKind.ENVIRONMENT) {
                continue;
            }
            String name = element.name().orElse("");
            if (element.isBoundary(LatexElement.BOUNDARY_BEGIN)) {
                stack.push(name);
            } else if (element.isBoundary(LatexElement.BOUNDARY_END)) {
                if (!stack.isEmpty() && stack.peek().equals(name)) {
                    stack.pop();
                } else {
                    issues.add(new ValidationIssue(IssueKind.UNMATCHED_ENVIRONMENT, Severity.ERROR,
                            "Environment closed without a matching \\begin: " + name, file.path(),
                            OptionalInt.of(lineOf(content, element.start())),
                            Optional.of("Check that \\begin{" + name + "} is matched by \\end{" + name + "}")));
                }
            }
        }
        List<String> unclosed = new ArrayList<>(stack);
        Collections.reverse(unclosed);
        for (String name : unclosed) {
            issues.add(ValidationIssue.error(IssueKind.UNCLOSED_ENVIRONMENT, file.path(),
                    "Environment not closed: " + name, "Add \\end{" + name + "}"));
        }
    }

    private void validateDependencies(ProjectModel model, List<ValidationIssue> issues) {
        for (LatexFile file : model.files().values()) {
            for (String dependency : file.dependencies()) {
                if (!model.files().containsKey(dependency)) {
                    issues.add(ValidationIssue.error(IssueKind.MISSING_DEPENDENCY, file.path(),
                            "Dependency not found: " + dependency,
                            "Create " + dependency + " or correct the path"));
                }
            }
        }
        for (List<String> cycle : model.cycles()) {
            issues.add(ValidationIssue.error(IssueKind.CIRCULAR_DEPENDENCY, cycle.get(0),
                    "Circular dependency: " + String.join(" -> ", cycle),
                    "Remove one of the \\input or \\include directives in the cycle"));
        }
    }

    private void validateReferences(ProjectModel model, List<ValidationIssue> issues) {
        Set<String> labels = model.allLabels();
        for (LatexFile file : model.files().values()) {
            for (String ref : file.refs()) {
                if (!labels.contains(ref)) {
                    issues.add(ValidationIssue.error(IssueKind.MISSING_LABEL, file.path(),
                            "Referenced label not found: " + ref, "Add \\label{" + ref + "}"));
                }
            }
        }
    }

    private void validateCustomDefinitions(ProjectModel model, List<ValidationIssue> issues) {
        DependencyGraph graph = model.dependencyGraph();
        for (LatexFile file : model.files().values()) {
            for (String command : file.usedCommands()) {
                CommandDefinition definition = model.globalCommands().get(command);
                if (definition == null || definition.sourceFile().equals(file.path())) {
                    continue;
                }
                if (!graph.reaches(file.path(), definition.sourceFile())) {
                    issues.add(ValidationIssue.warning(IssueKind.MISSING_COMMAND_DEPENDENCY, file.path(), 0,
                            "Command \\" + command + " is defined in " + definition.sourceFile()
                                    + " which this file does not depend on",
                            "Add \\input{" + definition.sourceFile() + "}"));
                }
            }
        }
    }

    private static int lineOf(String content, int offset) {
        int line = 1;
        int limit = Math.min(offset, content.length());
        for (int i = 0; i < limit; i++) {
            if (content.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private static String excerpt(String line) {
        String stripped = line.strip();
        return stripped.length() <= EXCERPT_LENGTH ? stripped : stripped.substring(0, EXCERPT_LENGTH) + "...";
    }
}
