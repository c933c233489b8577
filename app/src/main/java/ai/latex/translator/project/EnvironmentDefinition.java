package ai.latex.translator.project;

import java.util.Objects;

/**
 * A custom environment introduced by {@code \newenvironment} or {@code \renewenvironment}.
 */
public record EnvironmentDefinition(String name, String definition, int arity, String sourceFile) {

    public EnvironmentDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(sourceFile, "sourceFile");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (arity < 0) {
            throw new IllegalArgumentException("arity must not be negative");
        }
    }
}
