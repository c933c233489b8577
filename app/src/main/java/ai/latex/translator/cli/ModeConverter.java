package ai.latex.translator.cli;

import ai.latex.translator.config.Mode;
import picocli.CommandLine;

/**
 * Parses {@code --mode}: analyze prints the project structure, validate reports issues, translate runs
 * the whole workflow.
 */
public class ModeConverter implements CommandLine.ITypeConverter<Mode> {

    @Override
    public Mode convert(String value) {
        return EnumChoices.convert(value, Mode::from, Mode.values());
    }
}
