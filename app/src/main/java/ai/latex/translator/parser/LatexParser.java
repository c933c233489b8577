package ai.latex.translator.parser;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic LaTeX scanner that decomposes source text into a sorted, gap-filled, non-overlapping
 * sequence of {@link LatexElement}s.
 *
 * <p>Element classes are located independently by pattern and then merged: candidates are ordered by
 * start offset and class priority, and a candidate overlapping an already accepted one is dropped.
 * Environments in {@link #NON_TRANSLATABLE_ENVIRONMENTS} are captured whole up to the first matching
 * {@code \end}, so nested environments of the same name are not supported. Every other environment
 * contributes one boundary element per {@code \begin}/{@code \end} marker and its body is parsed as
 * ordinary text.
 */
public class LatexParser {

    public static final Set<String> NON_TRANSLATABLE_COMMANDS = Set.of(
            "cite", "ref", "label", "includegraphics", "input", "include", "documentclass", "usepackage",
            "newcommand", "renewcommand", "providecommand", "def", "let", "url", "href", "hyperref",
            "pageref", "autoref", "nameref", "eqref", "cref", "Cref", "bibliography", "bibliographystyle",
            "addbibresource", "subfile", "InputIfFileExists", "newenvironment", "renewenvironment",
            "bibitem", "vspace", "hspace", "setlength", "addtolength", "setcounter", "newtheorem",
            "graphicspath", "hypersetup", "geometry", "pagestyle", "thispagestyle", "lstset",
            "lstinputlisting", "begin", "end");

    public static final Set<String> NON_TRANSLATABLE_ENVIRONMENTS = Set.of(
            "equation", "align", "gather", "multline", "flalign", "alignat", "eqnarray", "displaymath",
            "verbatim", "lstlisting", "minted", "algorithm", "algorithmic", "tikzpicture", "pgfpicture");

    /**
     * Sectioning commands ordered from the highest to the lowest level.
     */
    public static final List<String> SECTION_COMMANDS = List.of(
            "part", "chapter", "section", "subsection", "subsubsection", "paragraph", "subparagraph");

    private static final Set<String> VERBATIM_ENVIRONMENTS = Set.of("verbatim", "lstlisting", "minted", "comment");

    private static final Pattern DISPLAY_MATH = Pattern.compile("\\$\\$[^$]+\\$\\$|\\\\\\[.*?\\\\\\]", Pattern.DOTALL);
    private static final Pattern INLINE_MATH = Pattern.compile("(?<!\\$)\\$(?:[^$\\\\]|\\\\.)+\\$|\\\\\\(.*?\\\\\\)", Pattern.DOTALL);
    private static final Pattern COMMENT = Pattern.compile("%[^\\n]*");
    private static final Pattern ENVIRONMENT_MARKER = Pattern.compile("\\\\(begin|end)\\{([^{}]+)\\}");
    private static final Pattern CITATION = Pattern.compile("\\\\((?:no)?cite[a-zA-Z]*)\\*?(?:\\[[^\\]]*\\]){0,2}\\{([^}]*)\\}");
    private static final Pattern REFERENCE = Pattern.compile("\\\\(ref|pageref|autoref|nameref|eqref|cref|Cref|vref)\\*?\\{([^}]*)\\}");
    private static final Pattern LABEL = Pattern.compile("\\\\label\\{([^}]*)\\}");
    private static final Pattern COMMAND_NAME = Pattern.compile("\\\\([a-zA-Z]+)");
    private static final Pattern SECTION_HEADING = Pattern.compile(
            "^[ \\t]*\\\\(part|chapter|section|subsection|subsubsection|paragraph|subparagraph)(?![a-zA-Z])(\\*?)",
            Pattern.MULTILINE);

    private static final int PRIORITY_DISPLAY_MATH = 0;
    private static final int PRIORITY_INLINE_MATH = 1;
    private static final int PRIORITY_COMMENT = 2;
    private static final int PRIORITY_BLOCK = 3;
    private static final int PRIORITY_CITATION = 4;
    private static final int PRIORITY_REFERENCE = 5;
    private static final int PRIORITY_LABEL = 6;
    private static final int PRIORITY_BOUNDARY = 7;
    private static final int PRIORITY_COMMAND = 8;

    private static final Comparator<Candidate> CANDIDATE_ORDER = Comparator
            .comparingInt((Candidate candidate) -> candidate.element().start())
            .thenComparingInt(Candidate::priority)
            .thenComparing(Comparator.comparingInt((Candidate candidate) -> candidate.element().length()).reversed());

    public List<LatexElement> parse(String source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        List<Candidate> candidates = new ArrayList<>();

        StringBuilder masked = new StringBuilder(source);
        findVerbatimBlocks(source, masked, candidates);
        findComments(source, masked, candidates);
        findOpaqueBlocks(source, masked, candidates);

        String scan = masked.toString();
        findMath(source, scan, candidates);
        findCitationsAndReferences(source, scan, candidates);
        findEnvironmentBoundaries(source, scan, candidates);
        findCommands(source, scan, candidates);

        candidates.sort(CANDIDATE_ORDER);
        List<LatexElement> accepted = new ArrayList<>();
        int cursor = 0;
        for (Candidate candidate : candidates) {
            LatexElement element = candidate.element();
            if (element.start() >= cursor && element.length() > 0) {
                accepted.add(element);
                cursor = element.end();
            }
        }
        return fillTextElements(source, accepted);
    }

    /**
     * Parses the body of a math element, the arguments of a command element or the body of a whole
     * (non-verbatim) environment element. Offsets of the returned elements refer to the source the
     * element was taken from.
     */
    public List<LatexElement> parseNested(LatexElement element) {
        Objects.requireNonNull(element, "element");
        int bodyStart = 0;
        int bodyEnd = 0;
        String content = element.content();
        switch (element.kind()) {
            case MATH_INLINE, MATH_DISPLAY -> {
                int delimiter = content.startsWith("$$") ? 2 : content.startsWith("$") ? 1 : 2;
                bodyStart = delimiter;
                bodyEnd = content.length() - delimiter;
            }
            case COMMAND -> {
                bodyStart = 1 + element.metadata(LatexElement.META_COMMAND).orElse("").length();
                if (bodyStart < content.length() && content.charAt(bodyStart) == '*') {
                    bodyStart++;
                }
                bodyEnd = content.length();
            }
            case ENVIRONMENT -> {
                String name = element.metadata(LatexElement.META_ENVIRONMENT).orElse("");
                if (!element.isBoundary(LatexElement.BOUNDARY_BLOCK) || isVerbatimEnvironment(name)) {
                    return List.of();
                }
                bodyStart = ("\\begin{" + name + "}").length();
                bodyEnd = content.length() - ("\\end{" + name + "}").length();
            }
            default -> {
                return List.of();
            }
        }
        if (bodyEnd <= bodyStart) {
            return List.of();
        }
        int offset = element.start() + bodyStart;
        List<LatexElement> nested = new ArrayList<>();
        for (LatexElement inner : parse(content.substring(bodyStart, bodyEnd))) {
            nested.add(new LatexElement(inner.kind(), inner.content(), inner.start() + offset, inner.end() + offset,
                    false, inner.metadata()));
        }
        return nested;
    }

    /**
     * Spans eligible for translation: translatable text and translatable commands carrying at least one
     * brace argument, in source order.
     */
    public List<TextReplacement> extractTranslatableSpans(String source) {
        List<TextReplacement> spans = new ArrayList<>();
        for (LatexElement element : parse(source)) {
            if (!element.translatable() || element.content().isBlank()) {
                continue;
            }
            boolean eligible = switch (element.kind()) {
                case TEXT -> true;
                case COMMAND -> !"0".equals(element.metadata().getOrDefault(LatexElement.META_ARGUMENTS, "0"));
                default -> false;
            };
            if (eligible) {
                spans.add(new TextReplacement(element.content(), element.start(), element.end()));
            }
        }
        return spans;
    }

    /**
     * Rebuilds {@code original} with every replacement range substituted by its text. Ranges must be
     * sorted, disjoint and inside the source, as returned by a previous parse of the same text.
     */
    public String preserveStructure(String original, List<TextReplacement> replacements) {
        Objects.requireNonNull(original, "original");
        if (replacements == null || replacements.isEmpty()) {
            return original;
        }
        StringBuilder result = new StringBuilder(original.length());
        int lastEnd = 0;
        for (TextReplacement replacement : replacements) {
            if (replacement.start() < lastEnd || replacement.end() > original.length()) {
                throw new IllegalArgumentException("Replacement [" + replacement.start() + ", " + replacement.end()
                        + ") overlaps a previous replacement or exceeds the source length " + original.length());
            }
            result.append(original, lastEnd, replacement.start());
            result.append(replacement.text());
            lastEnd = replacement.end();
        }
        result.append(original, lastEnd, original.length());
        return result.toString();
    }

    /**
     * Splits a document at sectioning commands. Concatenating the slice texts yields the source.
     */
    public List<SectionSlice> splitBySections(String source) {
        if (source == null || source.isEmpty()) {
            return List.of(new SectionSlice("", source == null ? "" : source));
        }
        String scan = LatexSyntax.maskComments(source);
        List<Integer> headingStarts = new ArrayList<>();
        List<String> headings = new ArrayList<>();
        Matcher matcher = SECTION_HEADING.matcher(scan);
        while (matcher.find()) {
            int index = matcher.end();
            int optionalEnd = LatexSyntax.skipGroup(scan, index, '[', ']');
            if (optionalEnd > 0) {
                index = optionalEnd;
            }
            String title = LatexSyntax.groupBody(scan, index);
            if (title == null) {
                continue;
            }
            headingStarts.add(matcher.start());
            headings.add(matcher.group(1) + ": " + title.strip());
        }
        if (headings.isEmpty()) {
            return List.of(new SectionSlice("", source));
        }
        List<SectionSlice> slices = new ArrayList<>();
        int first = headingStarts.get(0);
        if (first > 0) {
            slices.add(new SectionSlice("", source.substring(0, first)));
        }
        for (int i = 0; i < headings.size(); i++) {
            int start = headingStarts.get(i);
            int end = i + 1 < headings.size() ? headingStarts.get(i + 1) : source.length();
            slices.add(new SectionSlice(headings.get(i), source.substring(start, end)));
        }
        return slices;
    }

    /**
     * Level of a sectioning command, {@code 0} for {@code part}, or {@code -1} for other names.
     */
    public static int sectionLevel(String command) {
        return SECTION_COMMANDS.indexOf(command);
    }

    public static boolean isTranslatableCommand(String name) {
        return !NON_TRANSLATABLE_COMMANDS.contains(name);
    }

    public static boolean isTranslatableEnvironment(String name) {
        return !NON_TRANSLATABLE_ENVIRONMENTS.contains(baseName(name));
    }

    /**
     * Environments whose body is taken literally by LaTeX.
     */
    public static boolean isVerbatimEnvironment(String name) {
        return VERBATIM_ENVIRONMENTS.contains(baseName(name));
    }

    private static String baseName(String environment) {
        return environment.endsWith("*") ? environment.substring(0, environment.length() - 1) : environment;
    }

    private void findVerbatimBlocks(String source, StringBuilder masked, List<Candidate> candidates) {
        Matcher matcher = ENVIRONMENT_MARKER.matcher(source);
        int from = 0;
        while (from < source.length() && matcher.find(from)) {
            from = matcher.end();
            String name = matcher.group(2);
            if (!"begin".equals(matcher.group(1)) || !isVerbatimEnvironment(name)
                    || LatexSyntax.isEscaped(source, matcher.start()) || insideComment(source, matcher.start())) {
                continue;
            }
            String endMarker = "\\end{" + name + "}";
            int endIndex = source.indexOf(endMarker, matcher.end());
            if (endIndex < 0) {
                continue;
            }
            int end = endIndex + endMarker.length();
            candidates.add(block(source, matcher.start(), end, name));
            mask(masked, matcher.start(), end);
            from = end;
        }
    }

    private void findComments(String source, StringBuilder masked, List<Candidate> candidates) {
        String scan = masked.toString();
        Matcher matcher = COMMENT.matcher(scan);
        int from = 0;
        while (from < scan.length() && matcher.find(from)) {
            if (LatexSyntax.isEscaped(scan, matcher.start())) {
                from = matcher.start() + 1;
                continue;
            }
            candidates.add(new Candidate(element(ElementKind.COMMENT, source, matcher.start(), matcher.end(), false,
                    Map.of()), PRIORITY_COMMENT));
            mask(masked, matcher.start(), matcher.end());
            from = Math.max(matcher.end(), matcher.start() + 1);
        }
    }

    private void findOpaqueBlocks(String source, StringBuilder masked, List<Candidate> candidates) {
        String scan = masked.toString();
        Matcher matcher = ENVIRONMENT_MARKER.matcher(scan);
        int from = 0;
        while (from < scan.length() && matcher.find(from)) {
            from = matcher.end();
            String name = matcher.group(2);
            if (!"begin".equals(matcher.group(1)) || isTranslatableEnvironment(name)
                    || LatexSyntax.isEscaped(scan, matcher.start())) {
                continue;
            }
            String endMarker = "\\end{" + name + "}";
            int endIndex = scan.indexOf(endMarker, matcher.end());
            if (endIndex < 0) {
                continue;
            }
            int end = endIndex + endMarker.length();
            candidates.add(block(source, matcher.start(), end, name));
            mask(masked, matcher.start(), end);
            from = end;
        }
    }

    private void findMath(String source, String scan, List<Candidate> candidates) {
        List<LatexElement> display = new ArrayList<>();
        Matcher matcher = DISPLAY_MATH.matcher(scan);
        int from = 0;
        while (from < scan.length() && matcher.find(from)) {
            if (LatexSyntax.isEscaped(scan, matcher.start())) {
                from = matcher.start() + 1;
                continue;
            }
            LatexElement element = element(ElementKind.MATH_DISPLAY, source, matcher.start(), matcher.end(), false, Map.of());
            display.add(element);
            candidates.add(new Candidate(element, PRIORITY_DISPLAY_MATH));
            from = matcher.end();
        }

        matcher = INLINE_MATH.matcher(scan);
        from = 0;
        while (from < scan.length() && matcher.find(from)) {
            int start = matcher.start();
            if (LatexSyntax.isEscaped(scan, start)) {
                from = start + 1;
                continue;
            }
            from = matcher.end();
            boolean insideDisplay = display.stream().anyMatch(d -> d.start() <= start && start < d.end());
            if (!insideDisplay) {
                candidates.add(new Candidate(element(ElementKind.MATH_INLINE, source, start, matcher.end(), false,
                        Map.of()), PRIORITY_INLINE_MATH));
            }
        }
    }

    private void findCitationsAndReferences(String source, String scan, List<Candidate> candidates) {
        forEachUnescaped(CITATION, scan, matcher -> candidates.add(new Candidate(element(ElementKind.CITATION, source,
                matcher.start(), matcher.end(), false,
                Map.of(LatexElement.META_COMMAND, matcher.group(1), LatexElement.META_KEYS, matcher.group(2))),
                PRIORITY_CITATION)));
        forEachUnescaped(REFERENCE, scan, matcher -> candidates.add(new Candidate(element(ElementKind.REFERENCE, source,
                matcher.start(), matcher.end(), false,
                Map.of(LatexElement.META_COMMAND, matcher.group(1), LatexElement.META_KEY, matcher.group(2).strip())),
                PRIORITY_REFERENCE)));
        forEachUnescaped(LABEL, scan, matcher -> candidates.add(new Candidate(element(ElementKind.LABEL, source,
                matcher.start(), matcher.end(), false,
                Map.of(LatexElement.META_KEY, matcher.group(1).strip())), PRIORITY_LABEL)));
    }

    private void findEnvironmentBoundaries(String source, String scan, List<Candidate> candidates) {
        forEachUnescaped(ENVIRONMENT_MARKER, scan, matcher -> {
            String boundary = matcher.group(1);
            String name = matcher.group(2);
            int end = matcher.end();
            if (LatexElement.BOUNDARY_BEGIN.equals(boundary)) {
                end = skipArguments(scan, end, new int[1]);
            }
            Map<String, String> metadata = Map.of(LatexElement.META_ENVIRONMENT, name, LatexElement.META_BOUNDARY, boundary);
            candidates.add(new Candidate(element(ElementKind.ENVIRONMENT, source, matcher.start(), end,
                    isTranslatableEnvironment(name), metadata), PRIORITY_BOUNDARY));
        });
    }

    private void findCommands(String source, String scan, List<Candidate> candidates) {
        forEachUnescaped(COMMAND_NAME, scan, matcher -> {
            String name = matcher.group(1);
            int index = matcher.end();
            if (index < scan.length() && scan.charAt(index) == '*') {
                index++;
            }
            int[] braceGroups = new int[1];
            int end = skipArguments(scan, index, braceGroups);
            Map<String, String> metadata = new HashMap<>();
            metadata.put(LatexElement.META_COMMAND, name);
            metadata.put(LatexElement.META_ARGUMENTS, Integer.toString(braceGroups[0]));
            candidates.add(new Candidate(element(ElementKind.COMMAND, source, matcher.start(), end,
                    isTranslatableCommand(name), metadata), PRIORITY_COMMAND));
        });
    }

    /**
     * Skips one optional bracket group followed by any number of brace groups, all directly adjacent.
     */
    private int skipArguments(String scan, int index, int[] braceGroups) {
        int optionalEnd = LatexSyntax.skipGroup(scan, index, '[', ']');
        if (optionalEnd > 0) {
            index = optionalEnd;
        }
        int groupEnd;
        while ((groupEnd = LatexSyntax.skipGroup(scan, index, '{', '}')) > 0) {
            index = groupEnd;
            braceGroups[0]++;
        }
        return index;
    }

    private List<LatexElement> fillTextElements(String source, List<LatexElement> elements) {
        if (elements.isEmpty()) {
            return List.of(text(source, 0, source.length()));
        }
        List<LatexElement> result = new ArrayList<>(elements.size() * 2 + 1);
        int lastEnd = 0;
        for (LatexElement element : elements) {
            if (element.start() > lastEnd) {
                result.add(text(source, lastEnd, element.start()));
            }
            result.add(element);
            lastEnd = element.end();
        }
        if (lastEnd < source.length()) {
            result.add(text(source, lastEnd, source.length()));
        }
        return List.copyOf(result);
    }

    private LatexElement text(String source, int start, int end) {
        String content = source.substring(start, end);
        if (content.isBlank()) {
            return new LatexElement(ElementKind.TEXT, content, start, end, false,
                    Map.of(LatexElement.META_WHITESPACE, "true"));
        }
        return new LatexElement(ElementKind.TEXT, content, start, end, true, Map.of());
    }

    private static Candidate block(String source, int start, int end, String name) {
        Map<String, String> metadata = Map.of(LatexElement.META_ENVIRONMENT, name,
                LatexElement.META_BOUNDARY, LatexElement.BOUNDARY_BLOCK);
        return new Candidate(element(ElementKind.ENVIRONMENT, source, start, end, false, metadata), PRIORITY_BLOCK);
    }

    private static LatexElement element(ElementKind kind, String source, int start, int end, boolean translatable,
                                        Map<String, String> metadata) {
        return new LatexElement(kind, source.substring(start, end), start, end, translatable, metadata);
    }

    private static void forEachUnescaped(Pattern pattern, String scan, Consumer<Matcher> action) {
        Matcher matcher = pattern.matcher(scan);
        int from = 0;
        while (from < scan.length() && matcher.find(from)) {
            if (LatexSyntax.isEscaped(scan, matcher.start())) {
                from = matcher.start() + 1;
                continue;
            }
            action.accept(matcher);
            from = Math.max(matcher.end(), matcher.start() + 1);
        }
    }

    private static boolean insideComment(String source, int index) {
        int lineStart = source.lastIndexOf('\n', index - 1) + 1;
        int comment = LatexSyntax.commentStart(source.subSequence(lineStart, index));
        return comment >= 0;
    }

    private static void mask(StringBuilder builder, int start, int end) {
        for (int i = start; i < end; i++) {
            if (builder.charAt(i) != '\n') {
                builder.setCharAt(i, ' ');
            }
        }
    }

    private record Candidate(LatexElement element, int priority) {
    }
}
