package eu.virtualparadox.knowledgebase.ingest.lifecycle;

import java.util.Locale;

/**
 * Stages an ingestion job moves through, in order. {@link #UNCHANGED} ends a job whose
 * content hash matched the current version.
 */
public enum JobStage {
    RECEIVED,
    CLASSIFYING,
    CHUNKING,
    EMBEDDING,
    INDEXING,
    COMPLETED,
    UNCHANGED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
