package ai.latex.translator.cli;

import ai.latex.translator.config.LogFormat;
import picocli.CommandLine;

public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {

    @Override
    public LogFormat convert(String value) {
        return EnumChoices.convert(value, LogFormat::from, LogFormat.values());
    }
}
