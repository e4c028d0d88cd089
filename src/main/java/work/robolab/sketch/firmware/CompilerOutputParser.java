package work.robolab.sketch.firmware;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import work.robolab.sketch.shared.Indentation;

/**
 * Extracts {@code file:line:column: message} errors from gcc-style compiler output.
 * Warnings and notes are dropped.
 */
public final class CompilerOutputParser {
    // The file part may itself contain colons, as in C:\...
    private static final Pattern ERROR_LINE = Pattern.compile("^(.*?):(\\d+):(\\d+):\\s*(.*)$");

    private CompilerOutputParser() {}

    public static List<CompileError> parse(String output) {
        var errors = new ArrayList<CompileError>();
        if (output == null) {
            return errors;
        }
        for (var line : Indentation.lines(output)) {
            var matcher = ERROR_LINE.matcher(line);
            if (!matcher.matches()) continue;
            int lineNumber;
            int column;
            try {
                lineNumber = Integer.parseInt(matcher.group(2));
                column = Integer.parseInt(matcher.group(3));
            } catch (NumberFormatException ex) {
                continue;
            }
            var message = matcher.group(4).trim();
            if (message.toLowerCase(Locale.ROOT).contains("error")) {
                errors.add(new CompileError(matcher.group(1), lineNumber, column, message));
            }
        }
        return errors;
    }
}
