package work.robolab.sketch.shared;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-wise indentation with a fixed two-space unit. Blank lines stay blank.
 */
public final class Indentation {
    public static final String UNIT = "  ";

    private Indentation() {}

    public static String indent(String text, int level) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String prefix = level <= 0 ? "" : UNIT.repeat(level);
        var out = new StringBuilder(text.length() + 16);
        var lines = lines(text);
        for (int i = 0; i < lines.size(); i++) {
            if (i > 0) out.append('\n');
            String line = lines.get(i);
            if (!line.isBlank()) {
                out.append(prefix).append(line);
            }
        }
        return out.toString();
    }

    /**
     * Splits on {@code \n} (tolerating {@code \r\n}); a single trailing newline does not yield an extra empty line.
     */
    public static List<String> lines(String text) {
        var result = new ArrayList<String>();
        if (text == null || text.isEmpty()) {
            return result;
        }
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                result.add(stripCarriageReturn(text.substring(start, i)));
                start = i + 1;
            }
        }
        if (start < text.length()) {
            result.add(stripCarriageReturn(text.substring(start)));
        }
        return result;
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
