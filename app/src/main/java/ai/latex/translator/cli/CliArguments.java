package ai.latex.translator.cli;

import ai.latex.translator.compile.LatexEngine;
import ai.latex.translator.config.LogFormat;
import ai.latex.translator.config.Mode;
import ai.latex.translator.translate.TargetLanguage;
import ai.latex.translator.translate.TranslationMode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "ai-latex-translator", mixinStandardHelpOptions = true,
        description = "Analyzes, validates and translates LaTeX projects")
public class CliArguments {

    @CommandLine.Parameters(index = "0", arity = "1", paramLabel = "PROJECT_ROOT", description = "Root directory of the LaTeX project")
    private Path projectRoot;

    @CommandLine.Option(names = "--mode", converter = ModeConverter.class, description = "Execution mode: analyze, validate or translate (default: validate)")
    private Mode mode;

    @CommandLine.Option(names = "--output", description = "Directory receiving the translated or fixed project", paramLabel = "DIR")
    private Path outputDirectory;

    @CommandLine.Option(names = "--target-language", converter = TargetLanguageConverter.class, description = "Target language: japanese, english, chinese or korean", paramLabel = "LANG")
    private TargetLanguage targetLanguage;

    @CommandLine.Option(names = "--translation-mode", description = "Translation execution mode: production, dry-run, or mock", converter = TranslationModeConverter.class)
    private TranslationMode translationMode;

    @CommandLine.Option(names = "--limit", description = "Maximum number of files to translate in this run", paramLabel = "COUNT")
    private Integer translationLimit;

    @CommandLine.Option(names = "--auto-fix", description = "Apply safe automatic fixes even when validation reports no errors")
    private boolean autoFix;

    @CommandLine.Option(names = "--compile", description = "Run a latexmk compile test on the final content")
    private boolean compile;

    @CommandLine.Option(names = "--bibtex", description = "Let latexmk run bibtex during the compile test")
    private boolean bibtex;

    @CommandLine.Option(names = "--engine", converter = LatexEngineConverter.class, description = "LaTeX engine: pdflatex, xelatex or lualatex", paramLabel = "ENGINE")
    private LatexEngine engine;

    @CommandLine.Option(names = "--compile-timeout", description = "Compile test timeout in seconds", paramLabel = "SECONDS")
    private Integer compileTimeoutSeconds;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Path projectRoot() {
        return projectRoot;
    }

    public Mode mode() {
        return mode;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    public TargetLanguage targetLanguage() {
        return targetLanguage;
    }

    public TranslationMode translationMode() {
        return translationMode;
    }

    public Integer translationLimit() {
        return translationLimit;
    }

    public boolean autoFix() {
        return autoFix;
    }

    public boolean compile() {
        return compile;
    }

    public boolean bibtex() {
        return bibtex;
    }

    public LatexEngine engine() {
        return engine;
    }

    public Integer compileTimeoutSeconds() {
        return compileTimeoutSeconds;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
