package eu.virtualparadox.knowledgebase.ingest.chunker;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Line start offsets of a text, for offset to line-number lookups and line iteration.
 */
public final class LineIndex {

    private final String source;
    private final int[] starts;

    public LineIndex(final String source) {
        this.source = source;
        final List<Integer> list = new ArrayList<>();
        list.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n' && i + 1 < source.length()) {
                list.add(i + 1);
            }
        }
        this.starts = list.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * @return 1-based line number containing {@code offset}
     */
    public int lineOf(final int offset) {
        final int idx = Arrays.binarySearch(starts, offset);
        return idx >= 0 ? idx + 1 : -idx - 1;
    }

    public int lineCount() {
        return starts.length;
    }

    /**
     * @param line 1-based line number
     */
    public int lineStart(final int line) {
        return starts[line - 1];
    }

    /**
     * @return end of {@code line} including its line feed
     */
    public int lineEnd(final int line) {
        return line < starts.length ? starts[line] : source.length();
    }

    /**
     * @return the line without its line feed
     */
    public String line(final int line) {
        int end = lineEnd(line);
        if (end > lineStart(line) && source.charAt(end - 1) == '\n') {
            end--;
        }
        return source.substring(lineStart(line), end);
    }
}
