package eu.virtualparadox.knowledgebase.ingest.lifecycle;

import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;

/**
 * Raw input of one ingestion.
 *
 * @param content       document text as received
 * @param origin        file name, path or URL; together with the knowledge base it identifies the document
 * @param knowledgeBase target knowledge base, {@code null} for the default one
 * @param contentHash   caller-computed SHA-256 of the normalized text, {@code null} to compute it
 * @param documentClass class to use instead of classifying, may be {@code null}
 */
public record IngestionRequest(String content,
                               String origin,
                               String knowledgeBase,
                               String contentHash,
                               DocumentClass documentClass) {

    public static IngestionRequest of(final String content, final String origin) {
        return new IngestionRequest(content, origin, null, null, null);
    }
}
