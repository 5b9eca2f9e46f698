package eu.virtualparadox.knowledgebase.error;

/**
 * Malformed input, rejected before any state is mutated.
 */
public class ValidationException extends KnowledgeBaseException {

    public ValidationException(final String message) {
        super(ErrorCode.VALIDATION, message);
    }
}
