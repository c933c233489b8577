package ai.latex.translator.compile;

/**
 * Compiles a LaTeX project on disk. Implementations report toolchain failures through the returned
 * outcome and block for at most the setting's timeout.
 */
public interface LatexCompiler {

    CompileOutcome compile(CompileSetting setting);
}
