package dev.ionfusion.fuusak.cli;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import dev.ionfusion.fuusak.shared.TextUtil;
import java.util.List;

/**
 * Unified diff between a file and its formatted text.
 */
final class DiffPrinter {
    private static final int CONTEXT_LINES = 3;
    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "\u001B[1m";
    private static final String RED = "\u001B[31m";
    private static final String GREEN = "\u001B[32m";
    private static final String CYAN = "\u001B[36m";

    private DiffPrinter() {}

    /**
     * Empty when the texts have the same lines.
     */
    static String unifiedDiff(String fileName, String original, String formatted, boolean color) {
        List<String> originalLines = TextUtil.lines(original);
        List<String> formattedLines = TextUtil.lines(formatted);
        Patch<String> patch = DiffUtils.diff(originalLines, formattedLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }
        List<String> diff = UnifiedDiffUtils.generateUnifiedDiff(
            fileName, fileName, originalLines, patch, CONTEXT_LINES);
        StringBuilder output = new StringBuilder();
        for (String line : diff) {
            output.append(color ? colorize(line) : line).append('\n');
        }
        return output.toString();
    }

    private static String colorize(String line) {
        if (line.startsWith("+++") || line.startsWith("---")) {
            return BOLD + line + RESET;
        }
        if (line.startsWith("@@")) {
            return CYAN + line + RESET;
        }
        if (line.startsWith("+")) {
            return GREEN + line + RESET;
        }
        if (line.startsWith("-")) {
            return RED + line + RESET;
        }
        return line;
    }
}
