package work.robolab.sketch.generator;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import work.robolab.sketch.shared.Indentation;

/**
 * Source template with {@code {identifier}} tokens, tokenized once.
 *
 * <p>Rendering is a single pass: each token is replaced by the resolver's value, substituted text
 * is never scanned again, and tokens the resolver does not know are kept verbatim (so C braces
 * such as {@code {}} or {@code { x = 1; }} pass through untouched). A line that consists of nothing
 * but one token stays in the output as an empty line when that token renders empty.
 */
public final class Template {
    private final List<List<Segment>> lines;

    private Template(List<List<Segment>> lines) {
        this.lines = lines;
    }

    public static Template parse(String text) {
        var lines = new ArrayList<List<Segment>>();
        for (var line : Indentation.lines(text == null ? "" : text)) {
            lines.add(tokenize(line));
        }
        return new Template(lines);
    }

    /**
     * Shorthand for {@code parse(text).render(resolver)}.
     */
    public static String render(String text, Function<String, String> resolver) {
        return parse(text).render(resolver);
    }

    /**
     * @param resolver returns the replacement for a token name, or {@code null} to keep the token
     */
    public String render(Function<String, String> resolver) {
        var out = new StringBuilder();
        boolean first = true;
        for (var segments : lines) {
            var rendered = new StringBuilder();
            boolean tokenOnly = isTokenOnly(segments);
            for (var segment : segments) {
                if (segment.token()) {
                    var value = resolver.apply(segment.text());
                    rendered.append(value == null ? "{" + segment.text() + "}" : value);
                } else {
                    rendered.append(segment.text());
                }
            }
            if (!first) out.append('\n');
            if (!(tokenOnly && rendered.toString().isBlank())) {
                out.append(rendered);
            }
            first = false;
        }
        return out.toString();
    }

    /**
     * Token names in order of first appearance.
     */
    public Set<String> tokens() {
        var names = new LinkedHashSet<String>();
        for (var segments : lines) {
            for (var segment : segments) {
                if (segment.token()) {
                    names.add(segment.text());
                }
            }
        }
        return names;
    }

    private static boolean isTokenOnly(List<Segment> segments) {
        int tokens = 0;
        for (var segment : segments) {
            if (segment.token()) {
                tokens++;
            } else if (!segment.text().isBlank()) {
                return false;
            }
        }
        return tokens == 1;
    }

    private static List<Segment> tokenize(String line) {
        var segments = new ArrayList<Segment>();
        var literal = new StringBuilder();
        int i = 0;
        while (i < line.length()) {
            char ch = line.charAt(i);
            if (ch == '{') {
                int end = scanIdentifier(line, i + 1);
                if (end > i + 1 && end < line.length() && line.charAt(end) == '}') {
                    if (literal.length() > 0) {
                        segments.add(new Segment(literal.toString(), false));
                        literal.setLength(0);
                    }
                    segments.add(new Segment(line.substring(i + 1, end), true));
                    i = end + 1;
                    continue;
                }
            }
            literal.append(ch);
            i++;
        }
        if (literal.length() > 0) {
            segments.add(new Segment(literal.toString(), false));
        }
        return segments;
    }

    private static int scanIdentifier(String line, int start) {
        int i = start;
        if (i < line.length() && (Character.isLetter(line.charAt(i)) || line.charAt(i) == '_')) {
            i++;
            while (i < line.length() && (Character.isLetterOrDigit(line.charAt(i)) || line.charAt(i) == '_')) {
                i++;
            }
        }
        return i;
    }

    private record Segment(String text, boolean token) {}
}
