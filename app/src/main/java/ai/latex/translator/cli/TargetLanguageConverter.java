package ai.latex.translator.cli;

import ai.latex.translator.translate.TargetLanguage;
import picocli.CommandLine;

public class TargetLanguageConverter implements CommandLine.ITypeConverter<TargetLanguage> {

    @Override
    public TargetLanguage convert(String value) {
        return EnumChoices.convert(value, TargetLanguage::from, TargetLanguage.values());
    }
}
