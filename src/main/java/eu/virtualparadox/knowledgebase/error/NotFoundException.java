package eu.virtualparadox.knowledgebase.error;

public class NotFoundException extends KnowledgeBaseException {

    public NotFoundException(final String kind, final String id) {
        super(ErrorCode.NOT_FOUND, kind + " not found: " + id);
    }
}
