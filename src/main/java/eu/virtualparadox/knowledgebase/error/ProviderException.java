package eu.virtualparadox.knowledgebase.error;

/**
 * A classifier, embedder or reranker backend failed after its retry budget was spent.
 */
public class ProviderException extends KnowledgeBaseException {

    public ProviderException(final String stage, final String message, final Throwable cause) {
        super(ErrorCode.PROVIDER, stage, message, cause);
    }
}
