package ai.latex.translator.project;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * File system helpers for the non-LaTeX files of a project (figures, bibliographies, class files).
 */
public final class ProjectAssets {

    private ProjectAssets() {
    }

    /**
     * Copies every regular file under {@code sourceRoot} whose relative path is not in {@code excluded}
     * into {@code targetRoot}. Version control metadata is skipped.
     *
     * @return the copied relative paths, sorted
     */
    public static List<String> copy(Path sourceRoot, Path targetRoot, Set<String> excluded) {
        if (!Files.isDirectory(sourceRoot)) {
            return List.of();
        }
        Path normalizedTarget = targetRoot.toAbsolutePath().normalize();
        List<String> copied = new ArrayList<>();
        try (Stream<Path> stream = Files.walk(sourceRoot)) {
            List<Path> candidates = stream.filter(Files::isRegularFile).sorted().toList();
            for (Path source : candidates) {
                if (source.toAbsolutePath().normalize().startsWith(normalizedTarget)) {
                    continue;
                }
                String relative = sourceRoot.relativize(source).toString().replace('\\', '/');
                if (relative.startsWith(".git/") || excluded.contains(relative)) {
                    continue;
                }
                Path target = targetRoot.resolve(relative);
                Files.createDirectories(target.getParent());
                Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
                copied.add(relative);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to copy project assets from " + sourceRoot, ex);
        }
        return copied;
    }

    /**
     * Deletes a directory tree, deepest entries first.
     */
    public static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> stream = Files.walk(root)) {
            List<Path> paths = stream.sorted(Comparator.reverseOrder()).toList();
            for (Path path : paths) {
                Files.deleteIfExists(path);
            }
        }
    }
}
