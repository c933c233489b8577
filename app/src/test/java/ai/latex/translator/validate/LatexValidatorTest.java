package ai.latex.translator.validate;

import static org.assertj.core.api.Assertions.assertThat;

import ai.latex.translator.compile.CompileError;
import ai.latex.translator.compile.CompileErrorType;
import ai.latex.translator.project.LatexProjectAnalyzer;
import ai.latex.translator.project.ProjectModel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LatexValidatorTest {

    private static final String HEADER = "\\documentclass{article}\n\\begin{document}\n";
    private static final String FOOTER = "\\end{document}\n";

    @TempDir
    Path tempDir;

    private final LatexProjectAnalyzer analyzer = new LatexProjectAnalyzer();
    private final LatexValidator validator = new LatexValidator();

    @Test
    void wellFormedProjectHasNoIssues() throws Exception {
        write("main.tex", HEADER + "\\section{Intro}\\label{sec:intro}\nSee \\ref{sec:intro}.\n" + FOOTER);

        ValidationReport report = validate();

        assertThat(report.issues()).isEmpty();
        assertThat(report.compilable()).isTrue();
    }

    @Test
    void reportsMissingDependencyOnTheIncludingFile() throws Exception {
        write("main.tex", HEADER + "\\input{missing}\n" + FOOTER);

        ValidationReport report = validate();

        assertThat(report.issuesOf(IssueKind.MISSING_DEPENDENCY)).singleElement().satisfies(issue -> {
            assertThat(issue.severity()).isEqualTo(Severity.ERROR);
            assertThat(issue.filePath()).isEqualTo("main.tex");
            assertThat(issue.message()).contains("missing.tex");
            assertThat(issue.describe()).startsWith("ERROR missing_dependency main.tex");
        });
        assertThat(report.compilable()).isFalse();
    }

    @Test
    void reportsUnclosedEnvironmentByName() throws Exception {
        write("main.tex", HEADER + "\\begin{theorem}\nClaim.\n" + FOOTER);

        ValidationReport report = validate();

        assertThat(report.issuesOf(IssueKind.UNCLOSED_ENVIRONMENT))
                .anySatisfy(issue -> {
                    assertThat(issue.isError()).isTrue();
                    assertThat(issue.message()).contains("theorem");
                });
        assertThat(report.issuesOf(IssueKind.UNMATCHED_ENVIRONMENT)).singleElement()
                .satisfies(issue -> assertThat(issue.lineNumber()).hasValue(5));
    }

    @Test
    void reportsEndWithoutBegin() throws Exception {
        write("main.tex", HEADER + "Text\n\\end{itemize}\n" + FOOTER);

        ValidationReport report = validate();

        assertThat(report.issuesOf(IssueKind.UNMATCHED_ENVIRONMENT)).singleElement()
                .satisfies(issue -> assertThat(issue.message()).contains("itemize"));
        assertThat(report.issuesOf(IssueKind.UNCLOSED_ENVIRONMENT)).isEmpty();
    }

    @Test
    void reportsMissingDocumentStructure() throws Exception {
        write("main.tex", "Hello\n");

        ValidationReport report = validate();

        assertThat(report.issues()).extracting(ValidationIssue::kind).contains(
                IssueKind.MISSING_DOCUMENTCLASS, IssueKind.MISSING_BEGIN_DOCUMENT, IssueKind.MISSING_END_DOCUMENT);
    }

    @Test
    void reportsMissingMainFileForEmptyProject() {
        ValidationReport report = validate();

        assertThat(report.issues()).extracting(ValidationIssue::kind).containsExactly(IssueKind.MISSING_MAIN_FILE);
        assertThat(report.compilable()).isFalse();
    }

    @Test
    void warnsWhenMainFileIsAGuess() throws Exception {
        write("notes.tex", "Notes\n");

        ValidationReport report = validate();

        assertThat(report.issuesOf(IssueKind.MAIN_FILE_FALLBACK)).singleElement()
                .satisfies(issue -> assertThat(issue.severity()).isEqualTo(Severity.WARNING));
    }

    @Test
    void lineLevelProblemsAreWarningsWithLineNumbers() throws Exception {
        write("main.tex", HEADER + "Open {brace here\nCosts 5$ only\n% {$ in a comment\n" + FOOTER);

        ValidationReport report = validate();

        assertThat(report.issuesOf(IssueKind.UNMATCHED_BRACES)).singleElement()
                .satisfies(issue -> assertThat(issue.lineNumber()).hasValue(3));
        assertThat(report.issuesOf(IssueKind.UNMATCHED_MATH_DELIMITERS)).singleElement()
                .satisfies(issue -> assertThat(issue.lineNumber()).hasValue(4));
        assertThat(report.compilable()).isTrue();
    }

    @Test
    void unknownCommandsAreReportedOncePerFile() throws Exception {
        write("main.tex", HEADER + "\\newcommand{\\known}{K}\n\\known \\mystery and \\mystery\n$\\oddsymbol$\n" + FOOTER);

        ValidationReport report = validate();

        assertThat(report.issuesOf(IssueKind.UNKNOWN_COMMAND))
                .extracting(ValidationIssue::message)
                .containsExactly("Unknown command: \\mystery", "Unknown command: \\oddsymbol");
        assertThat(report.issuesOf(IssueKind.UNKNOWN_COMMAND).get(0).lineNumber()).hasValue(4);
    }

    @Test
    void reportsReferencesToUndefinedLabels() throws Exception {
        write("main.tex", HEADER + "\\input{body}\nSee \\ref{fig:none}.\n" + FOOTER);
        write("body.tex", "\\label{fig:one} and \\ref{fig:one}\n");

        ValidationReport report = validate();

        assertThat(report.issuesOf(IssueKind.MISSING_LABEL)).singleElement().satisfies(issue -> {
            assertThat(issue.filePath()).isEqualTo("main.tex");
            assertThat(issue.message()).contains("fig:none");
        });
    }

    @Test
    void reportsEachCycleOnce() throws Exception {
        write("main.tex", HEADER + "\\input{a}\n" + FOOTER);
        write("a.tex", "\\input{b}\n");
        write("b.tex", "\\input{a}\n");

        ValidationReport report = validate();

        assertThat(report.issuesOf(IssueKind.CIRCULAR_DEPENDENCY)).singleElement().satisfies(issue -> {
            assertThat(issue.filePath()).isEqualTo("a.tex");
            assertThat(issue.message()).contains("a.tex -> b.tex -> a.tex");
        });
        assertThat(report.compilable()).isFalse();
    }

    @Test
    void warnsWhenACommandComesFromAFileOutsideTheCompilation() throws Exception {
        write("main.tex", HEADER + "\\input{defs}\n\\input{body}\n" + FOOTER);
        write("defs.tex", "\\newcommand{\\R}{\\mathbb{R}}\n");
        write("body.tex", "Let $x \\in \\R$.\n");
        write("orphan.tex", "Also $\\R$.\n");

        ValidationReport report = validate();

        assertThat(report.issuesOf(IssueKind.MISSING_COMMAND_DEPENDENCY))
                .extracting(ValidationIssue::filePath)
                .containsExactlyInAnyOrder("body.tex", "orphan.tex");
        assertThat(report.issuesOf(IssueKind.MISSING_COMMAND_DEPENDENCY))
                .allSatisfy(issue -> assertThat(issue.severity()).isEqualTo(Severity.WARNING));
        assertThat(report.compilable()).isTrue();
    }

    @Test
    void warnsWhenASiblingUsesCommandsFromFilesItDoesNotInclude() throws Exception {
        write("main.tex", HEADER + "\\newcommand{\\R}{\\mathbb{R}}\n\\input{sec}\n\\input{defs}\n" + FOOTER);
        write("sec.tex", "Take $\\R$ and \\myop{x}.\n");
        write("defs.tex", "\\newcommand{\\myop}[1]{\\operatorname{op}(#1)}\n");

        ValidationReport report = validate();

        assertThat(report.issuesOf(IssueKind.MISSING_COMMAND_DEPENDENCY))
                .allSatisfy(issue -> assertThat(issue.filePath()).isEqualTo("sec.tex"))
                .extracting(ValidationIssue::message)
                .containsExactlyInAnyOrder(
                        "Command \\R is defined in main.tex which this file does not depend on",
                        "Command \\myop is defined in defs.tex which this file does not depend on");
    }

    @Test
    void noCommandWarningWhenTheUserIncludesTheDefinitions() throws Exception {
        write("main.tex", HEADER + "\\input{sec}\n" + FOOTER);
        write("sec.tex", "\\input{defs}\nTake \\myop{x}.\n");
        write("defs.tex", "\\newcommand{\\myop}[1]{\\operatorname{op}(#1)}\n");

        ValidationReport report = validate();

        assertThat(report.issuesOf(IssueKind.MISSING_COMMAND_DEPENDENCY)).isEmpty();
    }

    @Test
    void unreadableFilesAreWarnings() throws Exception {
        write("main.tex", HEADER + FOOTER);
        Files.write(tempDir.resolve("broken.tex"), new byte[] {(byte) 0xC3, (byte) 0x28});

        ValidationReport report = validate();

        assertThat(report.issuesOf(IssueKind.UNREADABLE_FILE)).singleElement()
                .satisfies(issue -> assertThat(issue.filePath()).isEqualTo("broken.tex"));
        assertThat(report.compilable()).isTrue();
    }

    @Test
    void autoFixReturnsChangedFilesWithoutTouchingTheModel() throws Exception {
        write("main.tex", HEADER + "Text（注）\n" + FOOTER);
        write("clean.tex", "Nothing to fix.\n");
        ProjectModel model = analyzer.analyze(tempDir);

        Map<String, String> fixes = validator.autoFixIssues(model);

        assertThat(fixes).containsOnlyKeys("main.tex");
        assertThat(fixes.get("main.tex")).contains("Text(注)");
        assertThat(model.file("main.tex").orElseThrow().isModified()).isFalse();
    }

    @Test
    void safeContextCollectsRulesCriticalCommandsAndCompileErrors() throws Exception {
        write("main.tex", HEADER + "\\input{defs}\n\\input{body}\n" + FOOTER);
        write("defs.tex", "\\newcommand{\\R}{\\mathbb{R}}\n");
        write("body.tex", "Let $x \\in \\R$ and \\mystery.\n");
        ProjectModel model = analyzer.analyze(tempDir);
        ValidationReport report = validator.validate(model);
        CompileError error = new CompileError(CompileErrorType.COMPILE_ERROR, "! Undefined control sequence.", "");

        SafeTranslationContext context = validator.safeContext(model, report, "body.tex", error).orElseThrow();

        assertThat(context.filePath()).isEqualTo("body.tex");
        assertThat(context.criticalCommands()).containsExactly("R");
        assertThat(context.rules()).containsAll(LatexValidator.TRANSLATION_RULES);
        assertThat(context.issues()).extracting(ValidationIssue::kind).contains(IssueKind.UNKNOWN_COMMAND);
        assertThat(context.compileErrors()).contains("! Undefined control sequence.");
        assertThat(context.toPromptText()).contains("\\R", "Previous compile errors:");

        SafeTranslationContext defs = validator.safeContext(model, report, "defs.tex").orElseThrow();
        assertThat(defs.rules()).anyMatch(rule -> rule.contains("custom commands defined in this file: R"));
        assertThat(defs.compileErrors()).isEmpty();
        assertThat(validator.safeContext(model, report, "none.tex")).isEmpty();
    }

    private ValidationReport validate() {
        return validator.validate(analyzer.analyze(tempDir));
    }

    private void write(String relative, String content) throws Exception {
        Path path = tempDir.resolve(relative);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content, StandardCharsets.UTF_8);
    }
}
