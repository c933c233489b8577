package ai.latex.translator.writer;

import ai.latex.translator.project.ProjectAssets;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.eclipse.jgit.api.AddCommand;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Materializes a translated project: assets copied from the source root, LaTeX files written as UTF-8.
 * When the output root is a git working tree the written files are staged.
 */
public class ProjectWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProjectWriter.class);

    public WriteSummary write(Path sourceRoot, Path outputRoot, Map<String, String> files) {
        if (sourceRoot == null || outputRoot == null || files == null) {
            throw new IllegalArgumentException("sourceRoot, outputRoot and files must be provided");
        }
        List<String> assets = List.of();
        boolean inPlace = sourceRoot.toAbsolutePath().normalize().equals(outputRoot.toAbsolutePath().normalize());
        if (!inPlace) {
            assets = ProjectAssets.copy(sourceRoot, outputRoot, files.keySet());
        }
        List<String> sources = new ArrayList<>(files.size());
        for (Map.Entry<String, String> entry : files.entrySet()) {
            Path target = outputRoot.resolve(entry.getKey()).normalize();
            if (!target.startsWith(outputRoot.normalize())) {
                throw new IllegalArgumentException("File path escapes the output root: " + entry.getKey());
            }
            try {
                Files.createDirectories(target.getParent());
                Files.writeString(target, entry.getValue(), StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to write translated document: " + target, ex);
            }
            sources.add(entry.getKey());
        }
        List<String> written = new ArrayList<>(assets);
        written.addAll(sources);
        boolean staged = stageIfRepository(outputRoot, written);
        LOGGER.info("Wrote {} LaTeX files and {} assets to {}", sources.size(), assets.size(), outputRoot);
        return new WriteSummary(sources, assets, staged);
    }

    private boolean stageIfRepository(Path outputRoot, List<String> relativePaths) {
        Path gitDirectory = outputRoot.resolve(".git");
        if (!Files.isDirectory(gitDirectory) || relativePaths.isEmpty()) {
            return false;
        }
        try (Git git = Git.open(outputRoot.toFile())) {
            AddCommand add = git.add();
            relativePaths.forEach(path -> add.addFilepattern(path.replace('\\', '/')));
            add.call();
            return true;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to open repository at " + outputRoot, ex);
        } catch (GitAPIException ex) {
            throw new IllegalStateException("Failed to stage translated documents in " + outputRoot, ex);
        }
    }
}
