package ai.latex.translator.validate;

import ai.latex.translator.parser.ElementKind;
import ai.latex.translator.parser.LatexElement;
import ai.latex.translator.parser.LatexParser;
import ai.latex.translator.parser.LatexSyntax;
import ai.latex.translator.parser.TextReplacement;
import ai.latex.translator.project.LatexFile;
import ai.latex.translator.project.ProjectModel;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Repairs damage machine translation commonly does to LaTeX source. Comments and verbatim blocks are
 * left untouched. Applying {@link #fix(String)} to its own output changes nothing.
 */
public class LatexAutoFixer {

    private static final Logger LOGGER = LoggerFactory.getLogger(LatexAutoFixer.class);

    static final Map<Character, Character> FULL_WIDTH = Map.ofEntries(
            Map.entry('（', '('), Map.entry('）', ')'),
            Map.entry('｛', '{'), Map.entry('｝', '}'),
            Map.entry('［', '['), Map.entry('］', ']'),
            Map.entry('＄', '$'), Map.entry('＼', '\\'),
            Map.entry('％', '%'), Map.entry('＆', '&'),
            Map.entry('＿', '_'), Map.entry('＾', '^'),
            Map.entry('｜', '|'), Map.entry('～', '~'),
            Map.entry('＃', '#'));

    private static final Pattern COMMAND_SPACE = Pattern.compile("\\\\([a-zA-Z]+)[ \\t]+\\{");
    private static final Pattern BLANK_LINE_RUN = Pattern.compile("\\n([ \\t]*\\n){2,}");

    private final LatexParser parser;

    public LatexAutoFixer() {
        this(new LatexParser());
    }

    public LatexAutoFixer(LatexParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    public String fix(String content) {
        if (content == null || content.isEmpty()) {
            return content == null ? "" : content;
        }
        String fixed = outsideProtected(content, LatexAutoFixer::replaceFullWidth);
        fixed = trimInlineMath(fixed);
        fixed = outsideProtected(fixed, LatexAutoFixer::removeCommandSpaces);
        return outsideProtected(fixed, segment -> BLANK_LINE_RUN.matcher(segment).replaceAll("\n\n"));
    }

    /**
     * Fixes every file of the model and returns the new content of the files that changed. A file that
     * cannot be fixed is logged and left out.
     */
    public Map<String, String> fixProject(ProjectModel model) {
        Objects.requireNonNull(model, "model");
        Map<String, String> fixed = new LinkedHashMap<>();
        for (LatexFile file : model.files().values()) {
            try {
                String result = fix(file.content());
                if (!result.equals(file.content())) {
                    fixed.put(file.path(), result);
                    LOGGER.info("Fixed issues in {}", file.path());
                }
            } catch (RuntimeException ex) {
                LOGGER.warn("Auto-fix failed for {}; content left unchanged", file.path(), ex);
            }
        }
        return fixed;
    }

    private String trimInlineMath(String content) {
        List<TextReplacement> replacements = new ArrayList<>();
        for (LatexElement element : parser.parse(content)) {
            if (element.kind() != ElementKind.MATH_INLINE || !element.content().startsWith("$")) {
                continue;
            }
            String text = element.content();
            String body = text.substring(1, text.length() - 1);
            String trimmed = body.strip();
            if (!trimmed.isEmpty() && !trimmed.equals(body)) {
                replacements.add(new TextReplacement("$" + trimmed + "$", element.start(), element.end()));
            }
        }
        return parser.preserveStructure(content, replacements);
    }

    /**
     * Applies {@code fix} to each maximal run of source outside comments and verbatim blocks.
     */
    private String outsideProtected(String content, UnaryOperator<String> fix) {
        StringBuilder result = new StringBuilder(content.length());
        int segmentStart = 0;
        for (LatexElement element : parser.parse(content)) {
            if (isProtected(element)) {
                result.append(fix.apply(content.substring(segmentStart, element.start())));
                result.append(element.content());
                segmentStart = element.end();
            }
        }
        result.append(fix.apply(content.substring(segmentStart)));
        return result.toString();
    }

    private static boolean isProtected(LatexElement element) {
        if (element.kind() == ElementKind.COMMENT) {
            return true;
        }
        return element.isBoundary(LatexElement.BOUNDARY_BLOCK)
                && element.metadata(LatexElement.META_ENVIRONMENT).map(LatexParser::isVerbatimEnvironment).orElse(false);
    }

    private static String replaceFullWidth(String segment) {
        StringBuilder builder = new StringBuilder(segment.length());
        for (int i = 0; i < segment.length(); i++) {
            char ch = segment.charAt(i);
            builder.append(FULL_WIDTH.getOrDefault(ch, ch));
        }
        return builder.toString();
    }

    private static String removeCommandSpaces(String segment) {
        Matcher matcher = COMMAND_SPACE.matcher(segment);
        StringBuilder builder = new StringBuilder(segment.length());
        while (matcher.find()) {
            String replacement = LatexSyntax.isEscaped(segment, matcher.start())
                    ? matcher.group()
                    : "\\" + matcher.group(1) + "{";
            matcher.appendReplacement(builder, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(builder);
        return builder.toString();
    }
}
