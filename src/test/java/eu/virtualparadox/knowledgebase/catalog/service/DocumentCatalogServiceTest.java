package eu.virtualparadox.knowledgebase.catalog.service;

import eu.virtualparadox.knowledgebase.catalog.entity.ChunkEntity;
import eu.virtualparadox.knowledgebase.catalog.entity.DocumentEntity;
import eu.virtualparadox.knowledgebase.error.ConflictException;
import eu.virtualparadox.knowledgebase.error.NotFoundException;
import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;
import eu.virtualparadox.knowledgebase.ingest.model.ChunkMetadata;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(DocumentCatalogService.class)
class DocumentCatalogServiceTest {

    @Autowired
    private DocumentCatalogService catalogService;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    void testFirstCommitCreatesDocument() {
        catalogService.commitVersion(commit("doc-1", 1, "hash-1", 2));
        entityManager.clear();

        final DocumentEntity document = catalogService.getDocument("doc-1");
        assertThat(document.getKnowledgeBase()).isEqualTo("kb");
        assertThat(document.getOrigin()).isEqualTo("notes/doc-1.md");
        assertThat(document.getCurrentVersion()).isEqualTo(1);
        assertThat(document.getContentHash()).isEqualTo("hash-1");
        assertThat(document.getDocumentClass()).isEqualTo(DocumentClass.MARKDOWN);

        final List<ChunkEntity> chunks = catalogService.liveChunks("doc-1", 1);
        assertThat(chunks).extracting(ChunkEntity::getId).containsExactly("doc-1:1:0", "doc-1:1:1");
        assertThat(chunks.get(0).getMetadata()).containsEntry(ChunkMetadata.HEADER_PATH, "Section 0");
        assertThat(catalogService.latestVersion("doc-1")).isEqualTo(1);
        assertThat(catalogService.isCommitted("doc-1", 1)).isTrue();
    }

    @Test
    void testNewVersionSoftDeletesPreviousChunks() {
        catalogService.commitVersion(commit("doc-1", 1, "hash-1", 2));
        catalogService.commitVersion(commit("doc-1", 2, "hash-2", 3));
        entityManager.clear();

        assertThat(catalogService.getDocument("doc-1").getCurrentVersion()).isEqualTo(2);
        assertThat(catalogService.chunks("doc-1", false))
                .extracting(ChunkEntity::getVersion)
                .containsOnly(2)
                .hasSize(3);
        final List<ChunkEntity> all = catalogService.chunks("doc-1", true);
        assertThat(all).hasSize(5);
        assertThat(all).filteredOn(ChunkEntity::isDeleted)
                .hasSize(2)
                .allSatisfy(chunk -> assertThat(chunk.getDeletedAt()).isNotNull());
        assertThat(catalogService.versions("doc-1")).extracting("version").containsExactly(1, 2);
        assertThat(catalogService.currentVersions()).containsExactly(Map.entry("doc-1", 2));
    }

    @Test
    void testReusedVersionNumberConflicts() {
        catalogService.commitVersion(commit("doc-1", 1, "hash-1", 1));

        assertThatThrownBy(() -> catalogService.commitVersion(commit("doc-1", 1, "hash-2", 1)))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void testNeighbourChunksStayWithinVersion() {
        catalogService.commitVersion(commit("doc-1", 1, "hash-1", 3));
        entityManager.clear();

        assertThat(catalogService.previousChunk("doc-1", 1, 100)).map(ChunkEntity::getOrdinal).contains(0);
        assertThat(catalogService.nextChunk("doc-1", 1, 100)).map(ChunkEntity::getOrdinal).contains(2);
        assertThat(catalogService.previousChunk("doc-1", 1, 0)).isEmpty();
        assertThat(catalogService.nextChunk("doc-1", 1, 200)).isEmpty();
    }

    @Test
    void testPurgeRemovesOnlyExpiredDeletedChunks() {
        catalogService.commitVersion(commit("doc-1", 1, "hash-1", 2));
        catalogService.commitVersion(commit("doc-1", 2, "hash-2", 1));
        entityManager.clear();

        assertThat(catalogService.purgeableChunkIds(Instant.now().minusSeconds(3600))).isEmpty();

        final List<String> purgeable = catalogService.purgeableChunkIds(Instant.now().plusSeconds(1));
        assertThat(purgeable).containsExactlyInAnyOrder("doc-1:1:0", "doc-1:1:1");

        assertThat(catalogService.purgeChunks(purgeable)).isEqualTo(2);
        entityManager.clear();

        assertThat(catalogService.purgeableChunkIds(Instant.now().plusSeconds(1))).isEmpty();
        assertThat(catalogService.chunks("doc-1", true)).extracting(ChunkEntity::getId).containsExactly("doc-1:2:0");
        assertThat(catalogService.chunks("doc-1", true)).extracting(ChunkEntity::getId).containsExactly("doc-1:2:0");
    }

    @Test
    void testRemoveDocumentDeletesEverything() {
        catalogService.commitVersion(commit("doc-1", 1, "hash-1", 2));
        catalogService.commitVersion(commit("doc-2", 1, "hash-3", 1));
        entityManager.clear();

        assertThat(catalogService.removeDocument("doc-1")).isTrue();
        entityManager.clear();

        assertThat(catalogService.findDocument("doc-1")).isEmpty();
        assertThat(catalogService.chunks("doc-1", true)).isEmpty();
        assertThat(catalogService.versions("doc-1")).isEmpty();
        assertThat(catalogService.latestVersion("doc-1")).isZero();
        assertThat(catalogService.documentIds("kb")).containsExactly("doc-2");
        assertThat(catalogService.removeDocument("doc-1")).isFalse();
    }

    @Test
    void testListDocumentsByKnowledgeBase() {
        catalogService.commitVersion(commit("doc-1", 1, "hash-1", 1));
        final VersionCommit other = commit("doc-9", 1, "hash-9", 1);
        catalogService.commitVersion(new VersionCommit(other.documentId(), "other", other.origin(),
                other.contentHash(), other.documentClass(), other.version(), other.chunks()));

        assertThat(catalogService.listDocuments("kb")).extracting(DocumentEntity::getId).containsExactly("doc-1");
        assertThat(catalogService.listDocuments(null)).extracting(DocumentEntity::getId)
                .containsExactly("doc-1", "doc-9");
        assertThatThrownBy(() -> catalogService.getDocument("missing")).isInstanceOf(NotFoundException.class);
    }

    private static VersionCommit commit(final String documentId, final int version, final String hash, final int chunkCount) {
        final List<ChunkEntity> chunks = new ArrayList<>();
        for (int i = 0; i < chunkCount; i++) {
            chunks.add(ChunkEntity.builder()
                    .id(ChunkEntity.chunkId(documentId, version, i))
                    .documentId(documentId)
                    .version(version)
                    .ordinal(i)
                    .text("chunk " + i + " of version " + version)
                    .startOffset(i * 100)
                    .endOffset(i * 100 + 90)
                    .tokenCount(5)
                    .metadata(Map.of(ChunkMetadata.HEADER_PATH, "Section " + i))
                    .build());
        }
        return new VersionCommit(documentId, "kb", "notes/" + documentId + ".md", hash,
                DocumentClass.MARKDOWN, version, chunks);
    }
}
