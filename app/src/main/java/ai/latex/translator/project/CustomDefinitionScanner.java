package ai.latex.translator.project;

import ai.latex.translator.parser.LatexSyntax;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds {@code \newcommand}-style, {@code \def} and {@code \newenvironment}-style definitions in
 * comment-free source.
 */
final class CustomDefinitionScanner {

    private static final Pattern COMMAND_DEFINITION = Pattern.compile("\\\\(newcommand|renewcommand|providecommand)\\*?\\s*");
    private static final Pattern BARE_NAME = Pattern.compile("\\\\([a-zA-Z@]+)");
    private static final Pattern DEF = Pattern.compile("\\\\[egx]?def\\s*\\\\([a-zA-Z@]+)([^{]*)");
    private static final Pattern PARAMETER = Pattern.compile("#[1-9]");
    private static final Pattern ENVIRONMENT_DEFINITION = Pattern.compile("\\\\(newenvironment|renewenvironment)\\*?\\s*\\{([^{}]+)\\}");
    private static final Pattern ARITY = Pattern.compile("\\s*\\[\\s*(\\d)\\s*\\]");

    List<CommandDefinition> commands(String source, String sourceFile) {
        List<CommandDefinition> definitions = new ArrayList<>();
        Matcher matcher = COMMAND_DEFINITION.matcher(source);
        while (matcher.find()) {
            if (LatexSyntax.isEscaped(source, matcher.start())) {
                continue;
            }
            int index = matcher.end();
            String name;
            if (index < source.length() && source.charAt(index) == '{') {
                String body = LatexSyntax.groupBody(source, index);
                if (body == null) {
                    continue;
                }
                name = stripBackslash(body.strip());
                index += body.length() + 2;
            } else {
                Matcher bare = BARE_NAME.matcher(source).region(index, source.length());
                if (!bare.lookingAt()) {
                    continue;
                }
                name = bare.group(1);
                index = bare.end();
            }
            int arity = 0;
            Matcher arityMatcher = ARITY.matcher(source).region(index, source.length());
            if (arityMatcher.lookingAt()) {
                arity = Integer.parseInt(arityMatcher.group(1));
                index = arityMatcher.end();
            }
            int optional = 0;
            int defaultStart = skipSpaces(source, index);
            int defaultEnd = LatexSyntax.skipGroup(source, defaultStart, '[', ']');
            if (defaultEnd > 0 && arity > 0) {
                optional = 1;
                index = defaultEnd;
            }
            String body = LatexSyntax.groupBody(source, skipSpaces(source, index));
            if (name.isEmpty() || body == null) {
                continue;
            }
            definitions.add(new CommandDefinition(name, body, arity, optional, sourceFile));
        }

        Matcher def = DEF.matcher(source);
        while (def.find()) {
            if (LatexSyntax.isEscaped(source, def.start())) {
                continue;
            }
            String body = LatexSyntax.groupBody(source, def.end());
            if (body == null) {
                continue;
            }
            int arity = (int) PARAMETER.matcher(def.group(2)).results().count();
            definitions.add(new CommandDefinition(def.group(1), body, arity, 0, sourceFile));
        }
        return definitions;
    }

    List<EnvironmentDefinition> environments(String source, String sourceFile) {
        List<EnvironmentDefinition> definitions = new ArrayList<>();
        Matcher matcher = ENVIRONMENT_DEFINITION.matcher(source);
        while (matcher.find()) {
            if (LatexSyntax.isEscaped(source, matcher.start())) {
                continue;
            }
            String name = matcher.group(2).strip();
            int index = matcher.end();
            int arity = 0;
            Matcher arityMatcher = ARITY.matcher(source).region(index, source.length());
            if (arityMatcher.lookingAt()) {
                arity = Integer.parseInt(arityMatcher.group(1));
                index = arityMatcher.end();
            }
            int defaultEnd = LatexSyntax.skipGroup(source, skipSpaces(source, index), '[', ']');
            if (defaultEnd > 0) {
                index = defaultEnd;
            }
            int beginStart = skipSpaces(source, index);
            String begin = LatexSyntax.groupBody(source, beginStart);
            if (begin == null || name.isEmpty()) {
                continue;
            }
            String end = LatexSyntax.groupBody(source, skipSpaces(source, beginStart + begin.length() + 2));
            if (end == null) {
                continue;
            }
            String definition = "\\begin{" + name + "}" + begin + "\\end{" + name + "}" + end;
            definitions.add(new EnvironmentDefinition(name, definition, arity, sourceFile));
        }
        return definitions;
    }

    private static String stripBackslash(String name) {
        return name.startsWith("\\") ? name.substring(1) : name;
    }

    private static int skipSpaces(String source, int index) {
        while (index < source.length() && Character.isWhitespace(source.charAt(index))) {
            index++;
        }
        return index;
    }
}
