package ai.latex.translator.validate;

import static org.assertj.core.api.Assertions.assertThat;

import ai.latex.translator.project.LatexProjectAnalyzer;
import ai.latex.translator.project.ProjectModel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LatexAutoFixerTest {

    private final LatexAutoFixer fixer = new LatexAutoFixer();

    @Test
    void replacesFullWidthDelimitersAndIsIdempotent() {
        String fixed = fixer.fix("結果（注）は＄x＄です");

        assertThat(fixed).isEqualTo("結果(注)は$x$です");
        assertThat(fixer.fix(fixed)).isEqualTo(fixed);
    }

    @Test
    void leavesCommentsAndVerbatimAlone() {
        String content = "% 注（コメント）\n"
                + "\\begin{verbatim}\n（raw）  \\textbf {x}\n\\end{verbatim}\n"
                + "本文（注）\n";

        String fixed = fixer.fix(content);

        assertThat(fixed).isEqualTo("% 注（コメント）\n"
                + "\\begin{verbatim}\n（raw）  \\textbf {x}\n\\end{verbatim}\n"
                + "本文(注)\n");
    }

    @Test
    void removesSpaceBetweenCommandAndArgument() {
        assertThat(fixer.fix("\\section {Intro} and \\textbf  {bold}")).isEqualTo("\\section{Intro} and \\textbf{bold}");
    }

    @Test
    void keepsLineBreakFollowedByLetters() {
        String content = "first\\\\textbf {x}";

        assertThat(fixer.fix(content)).isEqualTo(content);
    }

    @Test
    void collapsesRunsOfBlankLines() {
        assertThat(fixer.fix("a\n\n\n\nb\n \n\t\nc")).isEqualTo("a\n\nb\n\nc");
    }

    @Test
    void trimsWhitespaceInsideInlineMath() {
        assertThat(fixer.fix("Value $ x + y $ and $z$.")).isEqualTo("Value $x + y$ and $z$.");
    }

    @Test
    void emptyInputStaysEmpty() {
        assertThat(fixer.fix("")).isEmpty();
        assertThat(fixer.fix(null)).isEmpty();
    }

    @Test
    void fixProjectReturnsOnlyChangedFiles(@TempDir Path tempDir) throws Exception {
        Files.writeString(tempDir.resolve("main.tex"),
                "\\documentclass{article}\n\\begin{document}\n\\input{body}\n\\end{document}\n",
                StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("body.tex"), "本文（注）\n", StandardCharsets.UTF_8);
        ProjectModel model = new LatexProjectAnalyzer().analyze(tempDir);

        Map<String, String> fixed = fixer.fixProject(model);

        assertThat(fixed).containsExactly(Map.entry("body.tex", "本文(注)\n"));
    }
}
