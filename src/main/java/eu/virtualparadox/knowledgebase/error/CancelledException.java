package eu.virtualparadox.knowledgebase.error;

/**
 * Raised at a stage boundary when the running job has been asked to stop.
 */
public class CancelledException extends KnowledgeBaseException {

    public CancelledException(final String stage, final String reason) {
        super(ErrorCode.CANCELLED, stage, "cancelled: " + reason, null);
    }
}
