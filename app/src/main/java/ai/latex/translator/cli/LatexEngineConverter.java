package ai.latex.translator.cli;

import ai.latex.translator.compile.LatexEngine;
import picocli.CommandLine;

public class LatexEngineConverter implements CommandLine.ITypeConverter<LatexEngine> {

    @Override
    public LatexEngine convert(String value) {
        return EnumChoices.convert(value, LatexEngine::from, LatexEngine.values());
    }
}
