package eu.virtualparadox.knowledgebase.catalog;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Status of an ingestion job. {@link #COMPLETED} and {@link #FAILED} are terminal.
 */
public enum EJobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
