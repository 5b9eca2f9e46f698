package eu.virtualparadox.knowledgebase.api.dto;

import eu.virtualparadox.knowledgebase.catalog.entity.DocumentVersionEntity;
import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;

import java.time.Instant;
import java.util.List;

public record DocumentDetailView(DocumentView document, List<VersionView> versions) {

    public record VersionView(int version, String contentHash, DocumentClass documentClass, int chunkCount,
                              Instant createdAt) {

        public static VersionView of(final DocumentVersionEntity version) {
            return new VersionView(version.getVersion(), version.getContentHash(), version.getDocumentClass(),
                    version.getChunkCount(), version.getCreatedAt());
        }
    }
}
