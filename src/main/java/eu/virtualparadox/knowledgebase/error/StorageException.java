package eu.virtualparadox.knowledgebase.error;

/**
 * Relational transaction or index write failure.
 */
public class StorageException extends KnowledgeBaseException {

    public StorageException(final String message, final Throwable cause) {
        super(ErrorCode.STORAGE, null, message, cause);
    }

    public StorageException(final String stage, final String message, final Throwable cause) {
        super(ErrorCode.STORAGE, stage, message, cause);
    }
}
