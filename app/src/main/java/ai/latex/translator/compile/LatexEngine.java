package ai.latex.translator.compile;

import java.util.Locale;

/**
 * TeX engines supported through latexmk.
 */
public enum LatexEngine {
    PDFLATEX("-pdf"),
    XELATEX("-xelatex"),
    LUALATEX("-lualatex");

    private final String latexmkFlag;

    LatexEngine(String latexmkFlag) {
        this.latexmkFlag = latexmkFlag;
    }

    public String latexmkFlag() {
        return latexmkFlag;
    }

    public static LatexEngine from(String value) {
        if (value == null || value.isBlank()) {
            return PDFLATEX;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "pdflatex", "pdf" -> PDFLATEX;
            case "xelatex", "xe" -> XELATEX;
            case "lualatex", "lua" -> LUALATEX;
            default -> throw new IllegalArgumentException("Unknown LaTeX engine: " + value);
        };
    }
}
