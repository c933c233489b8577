package ai.latex.translator.parser;

/**
 * Low-level lexical helpers shared by the parser, the project analyzer and the validator.
 */
public final class LatexSyntax {

    private LatexSyntax() {
    }

    /**
     * Returns {@code true} when the character at {@code index} is preceded by an odd number of backslashes.
     */
    public static boolean isEscaped(CharSequence source, int index) {
        int backslashes = 0;
        for (int i = index - 1; i >= 0 && source.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    /**
     * Skips a balanced group opening at {@code index}.
     *
     * @return the index just past the closing delimiter, or {@code -1} when no balanced group starts there
     */
    public static int skipGroup(CharSequence source, int index, char open, char close) {
        if (index >= source.length() || source.charAt(index) != open) {
            return -1;
        }
        int depth = 0;
        for (int i = index; i < source.length(); i++) {
            char ch = source.charAt(i);
            if (ch == '\\') {
                i++;
                continue;
            }
            if (ch == open) {
                depth++;
            } else if (ch == close) {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return -1;
    }

    /**
     * Body of the balanced brace group opening at {@code index}, without the braces, or {@code null}.
     */
    public static String groupBody(CharSequence source, int index) {
        int end = skipGroup(source, index, '{', '}');
        if (end < 0) {
            return null;
        }
        return source.subSequence(index + 1, end - 1).toString();
    }

    /**
     * Index of the first unescaped {@code %} of a line, or {@code -1}.
     */
    public static int commentStart(CharSequence line) {
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == '%' && !isEscaped(line, i)) {
                return i;
            }
        }
        return -1;
    }

    public static String stripComment(String line) {
        int index = commentStart(line);
        return index < 0 ? line : line.substring(0, index);
    }

    /**
     * Removes comments while keeping line breaks so line numbers stay stable.
     */
    public static String stripComments(String content) {
        if (content == null || content.indexOf('%') < 0) {
            return content == null ? "" : content;
        }
        String[] lines = content.split("\n", -1);
        StringBuilder builder = new StringBuilder(content.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                builder.append('\n');
            }
            builder.append(stripComment(lines[i]));
        }
        return builder.toString();
    }

    /**
     * Replaces comment text with spaces, keeping every offset of the source valid.
     */
    public static String maskComments(String content) {
        if (content == null || content.indexOf('%') < 0) {
            return content == null ? "" : content;
        }
        StringBuilder builder = new StringBuilder(content);
        int lineStart = 0;
        while (lineStart <= content.length()) {
            int lineEnd = content.indexOf('\n', lineStart);
            if (lineEnd < 0) {
                lineEnd = content.length();
            }
            int comment = commentStart(content.subSequence(lineStart, lineEnd));
            if (comment >= 0) {
                for (int i = lineStart + comment; i < lineEnd; i++) {
                    builder.setCharAt(i, ' ');
                }
            }
            lineStart = lineEnd + 1;
        }
        return builder.toString();
    }

    /**
     * Counts occurrences of {@code target} that are not escaped with a backslash.
     */
    public static int countUnescaped(CharSequence line, char target) {
        int count = 0;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == target && !isEscaped(line, i)) {
                count++;
            }
        }
        return count;
    }
}
