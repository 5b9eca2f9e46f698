package eu.virtualparadox.knowledgebase.error;

import lombok.Getter;

/**
 * Root of the knowledge base error taxonomy.
 * <p>
 * Every failure carries an {@link ErrorCode} and, when raised inside an ingestion run,
 * the name of the stage it happened in. The stage is prepended to the message so that
 * job records read like {@code [embedding] provider unavailable}.
 */
@Getter
public class KnowledgeBaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String stage;

    public KnowledgeBaseException(final ErrorCode errorCode, final String message) {
        this(errorCode, null, message, null);
    }

    public KnowledgeBaseException(final ErrorCode errorCode,
                                  final String stage,
                                  final String message,
                                  final Throwable cause) {
        super(stage == null ? message : "[" + stage + "] " + message, cause);
        this.errorCode = errorCode;
        this.stage = stage;
    }
}
