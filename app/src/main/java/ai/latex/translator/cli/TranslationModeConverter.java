package ai.latex.translator.cli;

import ai.latex.translator.translate.TranslationMode;
import picocli.CommandLine;

/**
 * Parses {@code --translation-mode}; {@code dry-run} and {@code dry_run} are the same choice.
 */
public class TranslationModeConverter implements CommandLine.ITypeConverter<TranslationMode> {

    @Override
    public TranslationMode convert(String value) {
        return EnumChoices.convert(value, TranslationMode::from, TranslationMode.values());
    }
}
