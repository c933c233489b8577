package ai.latex.translator.validate;

public enum Severity {
    ERROR,
    WARNING,
    INFO
}
