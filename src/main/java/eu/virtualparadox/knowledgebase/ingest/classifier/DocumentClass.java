package eu.virtualparadox.knowledgebase.ingest.classifier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import eu.virtualparadox.knowledgebase.error.ValidationException;

import java.util.Locale;

/**
 * Content-type label that selects the chunking strategy.
 */
public enum DocumentClass {
    TEXT,
    CODE,
    TABLE,
    MARKDOWN,
    CONFIG,
    LOG,
    MIXED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws ValidationException for names outside the supported set
     */
    @JsonCreator
    public static DocumentClass fromValue(final String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("document class must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new ValidationException("unsupported document class: " + value);
        }
    }
}
