package ai.latex.translator.validate;

import ai.latex.translator.project.TranslationContext;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Guidance for translating one file without breaking compilation. Advisory only: nothing enforces it.
 *
 * @param criticalCommands custom commands the file uses that another file defines
 * @param compileErrors critical lines of the last compile log, when a compile error was supplied
 */
public record SafeTranslationContext(TranslationContext context, List<ValidationIssue> issues,
                                     List<String> criticalCommands, List<String> rules,
                                     Optional<String> compileErrors) {

    public SafeTranslationContext {
        Objects.requireNonNull(context, "context");
        issues = List.copyOf(issues);
        criticalCommands = List.copyOf(criticalCommands);
        rules = List.copyOf(rules);
        compileErrors = compileErrors == null ? Optional.empty() : compileErrors;
    }

    public String filePath() {
        return context.filePath();
    }

    /**
     * Renders the rules, critical commands and known problems as plain text for a translation prompt.
     */
    public String toPromptText() {
        StringBuilder builder = new StringBuilder();
        builder.append("Rules:\n");
        rules.forEach(rule -> builder.append("- ").append(rule).append('\n'));
        if (!criticalCommands.isEmpty()) {
            builder.append("Commands defined elsewhere in the project: \\")
                    .append(String.join(", \\", criticalCommands)).append('\n');
        }
        compileErrors.ifPresent(errors -> builder.append("Previous compile errors:\n").append(errors).append('\n'));
        return builder.toString();
    }
}
