package eu.virtualparadox.knowledgebase.ingest.token;

/**
 * Half-open character span {@code [start, end)} of one token in its source text.
 */
public record TokenSpan(int start, int end) {
}
