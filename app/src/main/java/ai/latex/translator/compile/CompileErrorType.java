package ai.latex.translator.compile;

public enum CompileErrorType {
    COMPILE_ERROR,
    COMPILE_TIMEOUT
}
