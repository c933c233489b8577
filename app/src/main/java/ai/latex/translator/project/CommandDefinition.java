package ai.latex.translator.project;

import java.util.Objects;

/**
 * A custom command introduced by {@code \newcommand}, {@code \renewcommand}, {@code \providecommand}
 * or {@code \def}.
 */
public record CommandDefinition(String name, String definition, int arity, int optionalArguments, String sourceFile) {

    public CommandDefinition {
        name = requireNonBlank(name, "name");
        definition = Objects.requireNonNull(definition, "definition");
        sourceFile = Objects.requireNonNull(sourceFile, "sourceFile");
        if (arity < 0 || optionalArguments < 0 || optionalArguments > arity) {
            throw new IllegalArgumentException("Invalid arity for command " + name);
        }
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
