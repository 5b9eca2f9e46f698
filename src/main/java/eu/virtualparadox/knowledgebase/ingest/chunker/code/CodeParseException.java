package eu.virtualparadox.knowledgebase.ingest.chunker.code;

/**
 * Raised when source code cannot be parsed into declarations, e.g. unbalanced braces or an
 * unterminated string. Callers fall back to token windows.
 */
public class CodeParseException extends RuntimeException {

    public CodeParseException(final String message) {
        super(message);
    }
}
