package ai.latex.translator.project;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.latex.translator.parser.LatexParser;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LatexProjectAnalyzerTest {

    @TempDir
    Path tempDir;

    private final LatexProjectAnalyzer analyzer = new LatexProjectAnalyzer();

    @Test
    void includedFilesAreCompiledBeforeTheirIncluder() throws Exception {
        write("main.tex", "\\documentclass{article}\n\\input{defs}\n\\begin{document}\nHi\n\\end{document}\n");
        write("defs.tex", "\\newcommand{\\R}{\\mathbb{R}}\n");

        ProjectModel model = analyzer.analyze(tempDir);

        assertThat(model.mainFile()).contains("main.tex");
        assertThat(model.mainFileSelection()).isEqualTo(MainFileSelection.CONVENTIONAL_NAME);
        assertThat(model.file("main.tex").orElseThrow().dependencies()).containsExactly("defs.tex");
        assertThat(model.dependencyGraph().dependenciesOf("main.tex")).containsExactly("defs.tex");
        assertThat(model.dependencyGraph().dependentsOf("defs.tex")).containsExactly("main.tex");
        assertThat(model.compilationOrder()).containsExactly("defs.tex", "main.tex");
        assertThat(model.cycles()).isEmpty();
    }

    @Test
    void dependencyPathsAreNormalized() throws Exception {
        write("main.tex", "\\documentclass{article}\n\\include{./chapters/intro}\n\\subfile{appendix.tex}\n"
                + "% \\input{commented}\n");
        write("chapters/intro.tex", "Intro\n");
        write("appendix.tex", "Appendix\n");

        ProjectModel model = analyzer.analyze(tempDir);

        assertThat(model.file("main.tex").orElseThrow().dependencies())
                .containsExactly("chapters/intro.tex", "appendix.tex");
        assertThat(model.files()).containsKeys("chapters/intro.tex");
    }

    @Test
    void existingNonLatexInputsAreAssetsNotDependencies() throws Exception {
        write("main.tex", "\\documentclass{article}\n\\input{table.csv}\n\\input{missing.dat}\n");
        write("table.csv", "a,b\n");

        ProjectModel model = analyzer.analyze(tempDir);

        LatexFile main = model.file("main.tex").orElseThrow();
        assertThat(main.assetInputs()).containsExactly("table.csv");
        assertThat(main.dependencies()).containsExactly("missing.dat");
    }

    @Test
    void cyclesAreReportedAndOrderStillCoversEveryFile() throws Exception {
        write("main.tex", "\\documentclass{article}\n\\input{a}\n");
        write("a.tex", "\\input{b}\n");
        write("b.tex", "\\input{a}\n");

        ProjectModel model = analyzer.analyze(tempDir);

        assertThat(model.cycles()).containsExactly(List.of("a.tex", "b.tex", "a.tex"));
        assertThat(model.compilationOrder()).containsExactly("b.tex", "a.tex", "main.tex");
    }

    @Test
    void unreadableFileGetsEmptyContentAndAFailureRecord() throws Exception {
        write("main.tex", "\\documentclass{article}\n");
        Files.write(tempDir.resolve("broken.tex"), new byte[] {(byte) 0xC3, (byte) 0x28});

        ProjectModel model = analyzer.analyze(tempDir);

        assertThat(model.file("broken.tex").orElseThrow().content()).isEmpty();
        assertThat(model.readFailures()).extracting(FileReadFailure::path).containsExactly("broken.tex");
    }

    @Test
    void mainFileFallsBackToDocumentClassThenFirstFile() throws Exception {
        write("chapter.tex", "Chapter text\n");
        write("root.tex", "% \\documentclass in a comment\n\\documentclass{report}\n");

        ProjectModel withClass = analyzer.analyze(tempDir);

        assertThat(withClass.mainFile()).contains("root.tex");
        assertThat(withClass.mainFileSelection()).isEqualTo(MainFileSelection.DOCUMENT_CLASS);
        assertThat(withClass.mainFileSelection().isReliable()).isTrue();

        write("root.tex", "% \\documentclass{report}\n");
        ProjectModel fallback = analyzer.analyze(tempDir);

        assertThat(fallback.mainFile()).contains("chapter.tex");
        assertThat(fallback.mainFileSelection()).isEqualTo(MainFileSelection.FALLBACK);
    }

    @Test
    void emptyProjectHasNoMainFile() {
        ProjectModel model = analyzer.analyze(tempDir);

        assertThat(model.mainFile()).isEmpty();
        assertThat(model.mainFileSelection()).isEqualTo(MainFileSelection.NONE);
        assertThat(model.files()).isEmpty();
    }

    @Test
    void rejectsMissingRoot() {
        assertThatThrownBy(() -> analyzer.analyze(tempDir.resolve("absent")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void recordsUsedNamesLabelsCitationsAndRefs() throws Exception {
        write("main.tex", """
                \\documentclass{article}
                \\begin{document}
                \\begin{figure}
                \\caption{Data from \\cite{smith, jones} as in \\ref{tab:one}}
                \\label{fig:one}
                \\end{figure}
                See $\\alpha$ and \\autoref{fig:one}.
                \\end{document}
                """);

        LatexFile main = analyzer.analyze(tempDir).file("main.tex").orElseThrow();

        assertThat(main.usedCommands()).contains("documentclass", "caption", "alpha");
        assertThat(main.usedEnvironments()).contains("document", "figure");
        assertThat(main.citations()).containsExactlyInAnyOrder("smith", "jones");
        assertThat(main.labels()).containsExactly("fig:one");
        assertThat(main.refs()).containsExactlyInAnyOrder("tab:one", "fig:one");
    }

    @Test
    void globalRegistriesKeepTheLastDefinition() throws Exception {
        write("main.tex", "\\documentclass{article}\n\\input{a}\n\\input{b}\n");
        write("a.tex", "\\newcommand{\\tool}{Alpha}\n\\newenvironment{note}{\\itshape}{}\n");
        write("b.tex", "\\renewcommand{\\tool}{Beta}\n");

        ProjectModel model = analyzer.analyze(tempDir);

        assertThat(model.globalCommands().get("tool").definition()).isEqualTo("Beta");
        assertThat(model.globalCommands().get("tool").sourceFile()).isEqualTo("b.tex");
        assertThat(model.globalEnvironments()).containsKey("note");
        assertThat(model.structure()).isEqualTo(new ProjectStructure(3, Optional.of("main.tex"), 1, 1, 2));
    }

    @Test
    void translationContextDescribesOneFile() throws Exception {
        write("main.tex", "\\documentclass{article}\n\\newcommand{\\R}{\\mathbb{R}}\n\\input{body}\n");
        write("body.tex", "Let $x \\in \\R$.\\label{eq:x}\n");

        ProjectModel model = analyzer.analyze(tempDir);
        TranslationContext main = model.translationContext("main.tex").orElseThrow();
        TranslationContext body = model.translationContext("body.tex").orElseThrow();

        assertThat(main.mainFile()).isTrue();
        assertThat(main.dependencies()).containsExactly("body.tex");
        assertThat(main.customCommands()).containsEntry("R", "\\mathbb{R}");
        assertThat(main.availableCommands()).contains("R", "section");
        assertThat(body.mainFile()).isFalse();
        assertThat(body.usedCommands()).contains("R");
        assertThat(body.labels()).containsExactly("eq:x");
        assertThat(model.translationContext("nope.tex")).isEmpty();
    }

    @Test
    void reanalyzeReflectsAppliedContent() throws Exception {
        write("main.tex", "\\documentclass{article}\n");
        ProjectModel model = analyzer.analyze(tempDir);

        model.applyContent(Map.of("main.tex", "\\documentclass{article}\n\\input{extra}\n", "unknown.tex", "x"));
        assertThat(model.file("main.tex").orElseThrow().isModified()).isTrue();
        ProjectModel refreshed = analyzer.reanalyze(model);

        assertThat(refreshed.files()).containsOnlyKeys("main.tex");
        assertThat(refreshed.file("main.tex").orElseThrow().dependencies()).containsExactly("extra.tex");
        assertThat(refreshed.file("main.tex").orElseThrow().isModified()).isFalse();

        model.restoreContent();
        assertThat(model.contents()).containsEntry("main.tex", "\\documentclass{article}\n");
    }

    @Test
    void analyzeSingleUsesTheParentDirectoryAsRoot() {
        ProjectModel model = analyzer.analyzeSingle(tempDir.resolve("solo.tex").toString(),
                "\\documentclass{article}\n\\begin{document}\nSolo\n\\end{document}\n");

        assertThat(model.root()).isEqualTo(tempDir.toAbsolutePath().normalize());
        assertThat(model.files()).containsOnlyKeys("solo.tex");
        assertThat(model.mainFileSelection()).isEqualTo(MainFileSelection.DOCUMENT_CLASS);
    }

    @Test
    void honoursConfiguredExtensions() throws Exception {
        write("main.tex", "\\documentclass{article}\n");
        write("style.sty", "\\newcommand{\\x}{y}\n");

        ProjectModel model = new LatexProjectAnalyzer(new LatexParser(), Set.of(".TEX", "sty"))
                .analyze(tempDir);

        assertThat(model.files()).containsOnlyKeys("main.tex", "style.sty");
    }

    private void write(String relative, String content) throws Exception {
        Path path = tempDir.resolve(relative);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content, StandardCharsets.UTF_8);
    }
}
