package ai.latex.translator.project;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProjectAssetsTest {

    @TempDir
    Path tempDir;

    @Test
    void copiesEverythingExceptExcludedFilesAndGitMetadata() throws Exception {
        Path source = tempDir.resolve("paper");
        Files.createDirectories(source.resolve("figures"));
        Files.createDirectories(source.resolve(".git"));
        Files.writeString(source.resolve("main.tex"), "main");
        Files.writeString(source.resolve("figures/plot.pdf"), "pdf");
        Files.writeString(source.resolve("refs.bib"), "@book{}");
        Files.writeString(source.resolve(".git/HEAD"), "ref");
        Path target = tempDir.resolve("out");

        List<String> copied = ProjectAssets.copy(source, target, Set.of("main.tex"));

        assertThat(copied).containsExactly("figures/plot.pdf", "refs.bib");
        assertThat(target.resolve("figures/plot.pdf")).hasContent("pdf");
        assertThat(target.resolve("main.tex")).doesNotExist();
        assertThat(target.resolve(".git")).doesNotExist();
    }

    @Test
    void skipsTheTargetWhenItLivesInsideTheSource() throws Exception {
        Files.writeString(tempDir.resolve("image.png"), "png");
        Path target = tempDir.resolve("translated");
        Files.createDirectories(target);
        Files.writeString(target.resolve("stale.txt"), "old");

        List<String> copied = ProjectAssets.copy(tempDir, target, Set.of());

        assertThat(copied).containsExactly("image.png");
    }

    @Test
    void deletesDirectoryTrees() throws Exception {
        Path root = tempDir.resolve("scratch");
        Files.createDirectories(root.resolve("a/b"));
        Files.writeString(root.resolve("a/b/file.txt"), "x");

        ProjectAssets.deleteRecursively(root);

        assertThat(root).doesNotExist();
    }
}
