package ai.latex.translator.compile;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Picks the lines of a TeX log that explain why a compilation failed.
 */
public final class CompileLogAnalyzer {

    public static final String NO_ERRORS = "No critical LaTeX errors found.";
    public static final String SEPARATOR = "\n\n--- LaTeX Error ---\n\n";

    private static final int CONTEXT_LINES = 2;

    // Ordered from the most to the least specific.
    private static final List<Pattern> CRITICAL_PATTERNS = List.of(
            Pattern.compile("LaTeX Error:"),
            Pattern.compile("! LaTeX Error:"),
            Pattern.compile("! Package .+ Error:"),
            Pattern.compile("! Undefined control sequence"),
            Pattern.compile("Runaway argument"),
            Pattern.compile("! Missing"),
            Pattern.compile("Error"));

    private CompileLogAnalyzer() {
    }

    public static String extractCriticalErrors(String log) {
        if (log == null || log.isBlank()) {
            return NO_ERRORS;
        }
        String[] lines = log.split("\\R", -1);
        List<String> blocks = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            if (!isCritical(lines[i])) {
                continue;
            }
            int start = Math.max(0, i - CONTEXT_LINES);
            int end = Math.min(lines.length, i + CONTEXT_LINES + 1);
            String block = String.join("\n", List.of(lines).subList(start, end)).strip();
            boolean duplicate = blocks.stream().anyMatch(existing -> existing.contains(block) || block.contains(existing));
            if (!duplicate) {
                blocks.add(block);
            }
        }
        return blocks.isEmpty() ? NO_ERRORS : String.join(SEPARATOR, blocks);
    }

    private static boolean isCritical(String line) {
        for (Pattern pattern : CRITICAL_PATTERNS) {
            if (pattern.matcher(line).find()) {
                return true;
            }
        }
        return false;
    }
}
