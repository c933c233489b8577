package ai.latex.translator.project;

import java.util.Optional;

/**
 * Summary figures of an analyzed project.
 */
public record ProjectStructure(int totalFiles, Optional<String> mainFile, int customCommands,
                               int customEnvironments, int dependencyDepth) {

    public ProjectStructure {
        mainFile = mainFile == null ? Optional.empty() : mainFile;
    }
}
