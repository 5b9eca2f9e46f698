package eu.virtualparadox.knowledgebase.catalog.service;

import eu.virtualparadox.knowledgebase.catalog.entity.ChunkEntity;
import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;

import java.util.List;

/**
 * Everything written by the version switch of one ingestion.
 *
 * @param version number of the new version, one above the document's latest
 * @param chunks  chunks of the new version; {@code versionId} is assigned on commit
 */
public record VersionCommit(String documentId,
                            String knowledgeBase,
                            String origin,
                            String contentHash,
                            DocumentClass documentClass,
                            int version,
                            List<ChunkEntity> chunks) {
}
