package ai.latex.translator.project;

/**
 * How the compilation entry point of a project was chosen.
 */
public enum MainFileSelection {
    CONVENTIONAL_NAME,
    DOCUMENT_CLASS,
    FALLBACK,
    NONE;

    public boolean isReliable() {
        return this == CONVENTIONAL_NAME || this == DOCUMENT_CLASS;
    }
}
