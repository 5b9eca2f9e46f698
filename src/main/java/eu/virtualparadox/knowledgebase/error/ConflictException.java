package eu.virtualparadox.knowledgebase.error;

/**
 * The target is busy, typically because an ingestion job for the same document is still running.
 */
public class ConflictException extends KnowledgeBaseException {

    public ConflictException(final String message) {
        super(ErrorCode.CONFLICT, message);
    }
}
