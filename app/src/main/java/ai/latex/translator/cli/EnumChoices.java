package ai.latex.translator.cli;

import java.util.Arrays;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;
import picocli.CommandLine;

/**
 * Runs an enum's {@code from} parser and turns its rejection into a picocli conversion error that lists
 * the accepted values.
 */
final class EnumChoices {

    private EnumChoices() {
    }

    static <E extends Enum<E>> E convert(String value, Function<String, E> parser, E[] choices) {
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage() + " (expected one of: " + describe(choices) + ")");
        }
    }

    static <E extends Enum<E>> String describe(E[] choices) {
        return Arrays.stream(choices)
                .map(choice -> choice.name().toLowerCase(Locale.ROOT).replace('_', '-'))
                .collect(Collectors.joining(", "));
    }
}
