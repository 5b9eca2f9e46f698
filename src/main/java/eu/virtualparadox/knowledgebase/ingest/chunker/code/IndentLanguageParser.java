package eu.virtualparadox.knowledgebase.ingest.chunker.code;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Declaration finder for Python. A {@code def} or {@code class} at the block's indentation
 * runs until the next non-blank line indented at or below it; decorators and comment lines
 * directly above belong to the declaration. Lines inside open brackets are continuations.
 */
public final class IndentLanguageParser implements StructuralParser {

    private static final Pattern DECLARATION = Pattern.compile(
            "^(?<indent>[ \\t]*)(?:async\\s+)?(?<kind>def|class)\\s+(?<name>[A-Za-z_]\\w*)");

    @Override
    public List<CodeUnit> parse(final String source, final int start, final int end, final CodeUnit container) {
        final char[] masked = mask(source, start, end);
        final List<Line> lines = lines(source, masked, start, end);
        final List<CodeUnit> units = new ArrayList<>();

        int base = -1;
        for (final Line line : lines) {
            if (!line.blank() && !line.continuation()) {
                base = line.indent();
                break;
            }
        }
        if (base < 0) {
            return units;
        }

        int floor = start;
        int i = 0;
        while (i < lines.size()) {
            final Line line = lines.get(i);
            if (line.blank() || line.continuation() || line.indent() != base) {
                i++;
                continue;
            }
            final Matcher m = DECLARATION.matcher(line.masked());
            if (!m.find()) {
                i++;
                continue;
            }

            int last = i;
            int j = i + 1;
            while (j < lines.size()) {
                final Line next = lines.get(j);
                if (!next.blank() && !next.continuation() && next.indent() <= base) {
                    break;
                }
                if (!next.blank()) {
                    last = j;
                }
                j++;
            }
            if (last == i && line.masked().strip().endsWith(":")) {
                throw new CodeParseException("missing body for '" + m.group("name") + "' at offset " + line.start());
            }

            int first = i;
            while (first > 0) {
                final Line previous = lines.get(first - 1);
                final String text = source.substring(previous.start(), previous.end()).strip();
                final boolean decorator = text.startsWith("@") && previous.indent() == base;
                final boolean comment = text.startsWith("#");
                if (previous.start() < floor || !(decorator || comment)) {
                    break;
                }
                first--;
            }

            final String kind = "class".equals(m.group("kind")) ? "class" : (container == null ? "function" : "method");
            final int bodyStart = bodyStart(lines, i, last);
            final CodeUnit unit = new CodeUnit(kind, m.group("name"), lines.get(first).start(),
                    lines.get(last).end(), bodyStart, lines.get(last).end());
            units.add(unit);
            floor = unit.end();
            i = last + 1;
        }
        return units;
    }

    /**
     * The body starts on the line after the header, once the header's brackets are closed.
     */
    private static int bodyStart(final List<Line> lines, final int header, final int last) {
        int k = header + 1;
        while (k <= last && lines.get(k).continuation()) {
            k++;
        }
        return k <= last ? lines.get(k).start() : lines.get(last).end();
    }

    private record Line(int start, int end, int indent, boolean blank, boolean continuation, String masked) {
    }

    private static List<Line> lines(final String source, final char[] masked, final int start, final int end) {
        final List<Line> lines = new ArrayList<>();
        int brackets = 0;
        int p = start;
        while (p < end) {
            final int nl = source.indexOf('\n', p);
            final int lineEnd = nl < 0 || nl >= end ? end : nl + 1;
            final String text = new String(masked, p, lineEnd - p);
            int indent = 0;
            while (indent < text.length() && (text.charAt(indent) == ' ' || text.charAt(indent) == '\t')) {
                indent++;
            }
            final boolean blank = text.isBlank();
            lines.add(new Line(p, lineEnd, indent, blank, brackets > 0, text));
            for (int k = 0; k < text.length(); k++) {
                final char c = text.charAt(k);
                if (c == '(' || c == '[' || c == '{') {
                    brackets++;
                } else if ((c == ')' || c == ']' || c == '}') && brackets > 0) {
                    brackets--;
                }
            }
            p = lineEnd;
        }
        return lines;
    }

    /**
     * Blanks comments and string literals, including triple-quoted ones, keeping line feeds.
     * A line whose only content was a multi-line string therefore reads as blank.
     */
    static char[] mask(final String source, final int start, final int end) {
        final char[] m = source.toCharArray();
        int i = start;
        while (i < end) {
            final char c = source.charAt(i);
            if (c == '#') {
                int j = source.indexOf('\n', i);
                j = j < 0 || j > end ? end : j;
                blank(m, i, j);
                i = j;
            } else if (source.startsWith("\"\"\"", i) || source.startsWith("'''", i)) {
                final String quote = source.substring(i, i + 3);
                final int close = source.indexOf(quote, i + 3);
                if (close < 0 || close + 3 > end) {
                    throw new CodeParseException("unterminated triple-quoted string at offset " + i);
                }
                // keep a marker so the line holding the opening quotes is not blank
                blank(m, i + 1, close + 3);
                i = close + 3;
            } else if (c == '"' || c == '\'') {
                int k = i + 1;
                while (k < end && source.charAt(k) != c && source.charAt(k) != '\n') {
                    k += source.charAt(k) == '\\' ? 2 : 1;
                }
                if (k >= end || source.charAt(k) != c) {
                    throw new CodeParseException("unterminated string literal at offset " + i);
                }
                blank(m, i + 1, k);
                i = k + 1;
            } else {
                i++;
            }
        }
        return m;
    }

    private static void blank(final char[] m, final int from, final int to) {
        for (int k = from; k < to; k++) {
            if (m[k] != '\n') {
                m[k] = ' ';
            }
        }
    }
}
