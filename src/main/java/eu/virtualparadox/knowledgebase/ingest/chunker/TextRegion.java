package eu.virtualparadox.knowledgebase.ingest.chunker;

/**
 * The part {@code [start, end)} of a source text handed to a strategy. Strategies emit
 * offsets relative to {@code source}, so regions of mixed documents need no re-basing.
 *
 * @param origin file name or URL, may be {@code null}
 */
public record TextRegion(String source, int start, int end, String origin) {

    public TextRegion {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (start < 0 || end > source.length() || start > end) {
            throw new IllegalArgumentException("invalid region [" + start + ", " + end + ") of " + source.length());
        }
    }

    public static TextRegion whole(final String source, final String origin) {
        return new TextRegion(source, 0, source.length(), origin);
    }

    public String text() {
        return source.substring(start, end);
    }

    public boolean isBlank() {
        for (int i = start; i < end; i++) {
            if (!Character.isWhitespace(source.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
