package ai.latex.translator.project;

import java.util.Set;

/**
 * Command and environment names known without looking at a project's own definitions.
 */
public final class LatexVocabulary {

    public static final Set<String> STANDARD_COMMANDS = Set.of(
            // document structure
            "documentclass", "usepackage", "RequirePackage", "input", "include", "includeonly", "subfile",
            "InputIfFileExists", "begin", "end", "part", "chapter", "section", "subsection", "subsubsection",
            "paragraph", "subparagraph", "appendix", "title", "author", "date", "thanks", "and", "maketitle",
            "tableofcontents", "listoffigures", "listoftables", "abstract", "frontmatter", "mainmatter",
            "backmatter", "item", "caption", "footnote", "footnotemark", "footnotetext", "marginpar",
            // definitions
            "newcommand", "renewcommand", "providecommand", "newenvironment", "renewenvironment", "def",
            "let", "newtheorem", "newcounter", "setcounter", "addtocounter", "stepcounter", "refstepcounter",
            "value", "arabic", "roman", "Roman", "alph", "Alph", "the", "makeatletter", "makeatother",
            // references and bibliography
            "label", "ref", "pageref", "cite", "nocite", "bibliography", "bibliographystyle", "bibitem",
            "addbibresource", "printbibliography",
            // fonts
            "textbf", "textit", "textsl", "textsc", "texttt", "textrm", "textsf", "textmd", "textup",
            "textnormal", "emph", "underline", "bfseries", "itshape", "slshape", "scshape", "ttfamily",
            "rmfamily", "sffamily", "mdseries", "upshape", "normalfont", "em", "bf", "it", "rm", "sf", "tt",
            "tiny", "scriptsize", "footnotesize", "small", "normalsize", "large", "Large", "LARGE", "huge",
            "Huge", "textsuperscript", "textsubscript", "textcolor", "color",
            // layout and spacing
            "newpage", "clearpage", "cleardoublepage", "pagebreak", "nopagebreak", "linebreak",
            "nolinebreak", "newline", "par", "noindent", "indent", "centering", "raggedright", "raggedleft",
            "hspace", "vspace", "hfill", "vfill", "hrule", "vrule", "hline", "cline", "quad", "qquad",
            "smallskip", "medskip", "bigskip", "setlength", "addtolength", "linewidth", "textwidth",
            "textheight", "columnwidth", "paperwidth", "baselineskip", "parindent", "parskip", "pagestyle",
            "thispagestyle", "pagenumbering", "mbox", "makebox", "fbox", "framebox", "parbox", "raisebox",
            "multicolumn", "includegraphics", "graphicspath", "centerline", "ldots", "dots", "cdots",
            "vdots", "ddots", "today", "LaTeX", "TeX", "protect", "relax", "ensuremath", "verb", "url",
            "footnoterule", "textbackslash", "S", "P", "dag", "ddag", "copyright", "pounds",
            // math
            "frac", "dfrac", "tfrac", "sqrt", "sum", "prod", "int", "iint", "oint", "lim", "limsup",
            "liminf", "sup", "inf", "max", "min", "arg", "argmax", "argmin", "det", "exp", "log", "ln",
            "sin", "cos", "tan", "cot", "sec", "csc", "arcsin", "arccos", "arctan", "sinh", "cosh", "tanh",
            "deg", "dim", "ker", "hom", "gcd", "Pr", "mod", "bmod", "pmod", "left", "right", "big", "Big",
            "bigg", "Bigg", "bigl", "bigr", "Bigl", "Bigr", "middle", "cdot", "times", "div", "pm", "mp",
            "ast", "star", "circ", "bullet", "oplus", "otimes", "odot", "cap", "cup", "wedge", "vee",
            "setminus", "leq", "le", "geq", "ge", "neq", "ne", "approx", "equiv", "sim", "simeq", "cong",
            "propto", "ll", "gg", "subset", "subseteq", "supset", "supseteq", "in", "notin", "ni", "forall",
            "exists", "nexists", "neg", "lnot", "emptyset", "varnothing", "infty", "partial", "nabla",
            "prime", "ell", "hbar", "Re", "Im", "aleph", "to", "rightarrow", "leftarrow", "Rightarrow",
            "Leftarrow", "leftrightarrow", "Leftrightarrow", "longrightarrow", "Longrightarrow",
            "mapsto", "implies", "iff", "uparrow", "downarrow", "mid", "parallel", "perp", "angle",
            "langle", "rangle", "lfloor", "rfloor", "lceil", "rceil", "lvert", "rvert", "lVert", "rVert",
            "vert", "Vert", "hat", "widehat", "tilde", "widetilde", "bar", "overline", "underbrace",
            "overbrace", "vec", "dot", "ddot", "acute", "grave", "check", "breve", "mathrm", "mathbf",
            "mathit", "mathsf", "mathtt", "mathcal", "mathbb", "boldsymbol", "operatorname", "text",
            "displaystyle", "textstyle", "scriptstyle", "limits", "nolimits", "stackrel", "overset",
            "underset", "binom", "choose", "not", "colon", "top", "intercal", "tag", "nonumber", "notag",
            "alpha", "beta", "gamma", "delta", "epsilon", "varepsilon", "zeta", "eta", "theta", "vartheta",
            "iota", "kappa", "lambda", "mu", "nu", "xi", "pi", "varpi", "rho", "varrho", "sigma", "varsigma",
            "tau", "upsilon", "phi", "varphi", "chi", "psi", "omega", "Gamma", "Delta", "Theta", "Lambda",
            "Xi", "Pi", "Sigma", "Upsilon", "Phi", "Psi", "Omega");

    public static final Set<String> STANDARD_ENVIRONMENTS = Set.of(
            "document", "abstract", "quote", "quotation", "verse", "itemize", "enumerate", "description",
            "list", "figure", "figure*", "table", "table*", "tabular", "tabular*", "array", "equation",
            "equation*", "align", "align*", "gather", "gather*", "multline", "multline*", "split",
            "eqnarray", "eqnarray*", "displaymath", "math", "center", "flushleft", "flushright", "minipage",
            "verbatim", "verbatim*", "thebibliography", "theindex", "titlepage", "appendix", "footnotesize",
            "small", "proof");

    /**
     * Commands and environments provided by widely used packages (amsmath, graphicx, hyperref, natbib,
     * tikz, listings, algorithmic, booktabs, cleveref and friends).
     */
    public static final Set<String> COMMON_PACKAGE_COMMANDS = Set.of(
            "align", "gather", "multline", "split", "aligned", "gathered", "cases", "matrix", "pmatrix",
            "bmatrix", "vmatrix", "Vmatrix", "mathbb", "mathfrak", "mathscr", "includegraphics", "rotatebox",
            "scalebox", "resizebox", "href", "url", "hyperref", "hypersetup", "autoref", "nameref", "geometry",
            "newgeometry", "fancyhf", "fancyhead", "fancyfoot", "pagestyle", "selectlanguage",
            "foreignlanguage", "citep", "citet", "citealp", "citealt", "citeauthor", "citeyear", "tikz",
            "tikzpicture", "node", "draw", "fill", "path", "usetikzlibrary", "lstlisting", "lstinputlisting",
            "lstset", "algorithm", "algorithmic", "algsetup", "State", "If", "ElsIf", "Else", "EndIf", "For",
            "EndFor", "While", "EndWhile", "Return", "Require", "Ensure", "Procedure", "EndProcedure",
            "toprule", "midrule", "bottomrule", "cmidrule", "addlinespace", "eqref", "cref", "Cref", "vref",
            "subcaption", "subfloat", "DeclareMathOperator", "numberwithin", "theoremstyle", "qedhere",
            "xspace", "SI", "si", "num", "todo", "definecolor", "colorbox", "multirow");

    private LatexVocabulary() {
    }

    public static boolean isKnownCommand(String name) {
        return STANDARD_COMMANDS.contains(name) || COMMON_PACKAGE_COMMANDS.contains(name);
    }

    public static boolean isKnownEnvironment(String name) {
        return STANDARD_ENVIRONMENTS.contains(name) || COMMON_PACKAGE_COMMANDS.contains(name);
    }
}
