package eu.virtualparadox.knowledgebase.api.dto;

import eu.virtualparadox.knowledgebase.catalog.entity.DocumentEntity;
import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;

import java.time.Instant;

public record DocumentView(String id,
                           String knowledgeBase,
                           String origin,
                           String contentHash,
                           DocumentClass documentClass,
                           int currentVersion,
                           Instant createdAt,
                           Instant updatedAt) {

    public static DocumentView of(final DocumentEntity document) {
        return new DocumentView(document.getId(), document.getKnowledgeBase(), document.getOrigin(),
                document.getContentHash(), document.getDocumentClass(), document.getCurrentVersion(),
                document.getCreatedAt(), document.getUpdatedAt());
    }
}
