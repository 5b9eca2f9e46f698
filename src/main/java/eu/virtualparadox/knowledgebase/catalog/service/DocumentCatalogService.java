package eu.virtualparadox.knowledgebase.catalog.service;

import eu.virtualparadox.knowledgebase.catalog.entity.ChunkEntity;
import eu.virtualparadox.knowledgebase.catalog.entity.DocumentEntity;
import eu.virtualparadox.knowledgebase.catalog.entity.DocumentVersionEntity;
import eu.virtualparadox.knowledgebase.catalog.repo.ChunkRepository;
import eu.virtualparadox.knowledgebase.catalog.repo.DocumentRepository;
import eu.virtualparadox.knowledgebase.catalog.repo.DocumentVersionRepository;
import eu.virtualparadox.knowledgebase.error.ConflictException;
import eu.virtualparadox.knowledgebase.error.NotFoundException;
import eu.virtualparadox.knowledgebase.error.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Service layer responsible for the relational side of the knowledge base.
 * <p>
 * Responsibilities:
 * <ul>
 *     <li>Committing a new document version together with its chunks, in one transaction</li>
 *     <li>Soft-deleting the chunks of superseded versions and purging them after retention</li>
 *     <li>Listing documents, versions and chunks, and resolving neighbouring chunks</li>
 * </ul>
 *
 * <p>The vector index is kept in step by the callers; the chunk id links both stores.
 * Persistence failures surface as {@link StorageException}.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentCatalogService {

    private static final int DELETE_BATCH = 500;

    private final DocumentRepository documentRepository;
    private final DocumentVersionRepository versionRepository;
    private final ChunkRepository chunkRepository;

    /**
     * Atomically records a new version.
     *
     * <p>Steps performed:
     * <ol>
     *     <li>Checks the version is above every committed one</li>
     *     <li>Creates the document or points it at the new version, hash and class</li>
     *     <li>Inserts the version row and its chunks</li>
     *     <li>Soft-deletes the chunks of every other version</li>
     * </ol>
     *
     * @throws ConflictException if the version number is already taken
     */
    @Transactional
    public DocumentVersionEntity commitVersion(final VersionCommit commit) {
        return storage("commit version " + commit.version() + " of " + commit.documentId(), () -> {
            final DocumentEntity document = documentRepository.findById(commit.documentId())
                    .orElseGet(() -> DocumentEntity.builder()
                            .id(commit.documentId())
                            .knowledgeBase(commit.knowledgeBase())
                            .build());
            final int latest = versionRepository.findMaxVersion(commit.documentId());
            if (commit.version() <= latest) {
                throw new ConflictException("version " + commit.version() + " of document "
                        + commit.documentId() + " already exists");
            }

            final Instant now = Instant.now();
            document.setOrigin(commit.origin());
            document.setContentHash(commit.contentHash());
            document.setDocumentClass(commit.documentClass());
            document.setCurrentVersion(commit.version());
            document.setUpdatedAt(now);
            documentRepository.saveAndFlush(document);

            final DocumentVersionEntity version = versionRepository.saveAndFlush(DocumentVersionEntity.builder()
                    .documentId(commit.documentId())
                    .version(commit.version())
                    .contentHash(commit.contentHash())
                    .documentClass(commit.documentClass())
                    .chunkCount(commit.chunks().size())
                    .build());

            for (final ChunkEntity chunk : commit.chunks()) {
                chunk.setVersionId(version.getId());
                chunk.setCreatedAt(now);
            }
            chunkRepository.saveAll(commit.chunks());

            final int retired = chunkRepository.softDeleteOtherVersions(commit.documentId(), commit.version(), now);

            log.info("Committed version {} of document {} with {} chunks, retired {} chunks",
                    commit.version(), commit.documentId(), commit.chunks().size(), retired);
            return version;
        });
    }

    @Transactional(readOnly = true)
    public Optional<DocumentEntity> findDocument(final String id) {
        return storage("find document " + id, () -> documentRepository.findById(id));
    }

    /**
     * @throws NotFoundException if the document does not exist
     */
    @Transactional(readOnly = true)
    public DocumentEntity getDocument(final String id) {
        return findDocument(id).orElseThrow(() -> new NotFoundException("document", id));
    }

    /**
     * @param knowledgeBase restricts the listing when not {@code null}
     */
    @Transactional(readOnly = true)
    public List<DocumentEntity> listDocuments(final String knowledgeBase) {
        return storage("list documents", () -> knowledgeBase == null
                ? documentRepository.findAllByOrderByKnowledgeBaseAscOriginAsc()
                : documentRepository.findByKnowledgeBaseOrderByOriginAsc(knowledgeBase));
    }

    @Transactional(readOnly = true)
    public List<String> documentIds(final String knowledgeBase) {
        return storage("list knowledge base " + knowledgeBase,
                () -> documentRepository.findIdsByKnowledgeBase(knowledgeBase));
    }

    @Transactional(readOnly = true)
    public List<DocumentVersionEntity> versions(final String documentId) {
        return storage("list versions of " + documentId,
                () -> versionRepository.findByDocumentIdOrderByVersionAsc(documentId));
    }

    /**
     * Highest committed version number, 0 for an unknown document.
     */
    @Transactional(readOnly = true)
    public int latestVersion(final String documentId) {
        return storage("read latest version of " + documentId, () -> versionRepository.findMaxVersion(documentId));
    }

    @Transactional(readOnly = true)
    public boolean isCommitted(final String documentId, final int version) {
        return storage("check version " + version + " of " + documentId,
                () -> versionRepository.existsByDocumentIdAndVersion(documentId, version));
    }

    /**
     * @return current version per document
     */
    @Transactional(readOnly = true)
    public Map<String, Integer> currentVersions() {
        return storage("read current versions", () -> {
            final Map<String, Integer> current = new LinkedHashMap<>();
            for (final DocumentEntity document : documentRepository.findAll()) {
                current.put(document.getId(), document.getCurrentVersion());
            }
            return current;
        });
    }

    /**
     * @param includeDeleted also return chunks of superseded versions
     */
    @Transactional(readOnly = true)
    public List<ChunkEntity> chunks(final String documentId, final boolean includeDeleted) {
        return storage("list chunks of " + documentId, () -> includeDeleted
                ? chunkRepository.findByDocumentIdOrderByVersionAscOrdinalAsc(documentId)
                : chunkRepository.findByDocumentIdAndDeletedFalseOrderByOrdinalAsc(documentId));
    }

    @Transactional(readOnly = true)
    public List<ChunkEntity> liveChunks(final String documentId, final int version) {
        return storage("list chunks of " + documentId,
                () -> chunkRepository.findByDocumentIdAndVersionAndDeletedFalseOrderByOrdinalAsc(documentId, version));
    }

    /**
     * Closest non-deleted chunk of the same version starting before {@code startOffset}.
     */
    @Transactional(readOnly = true)
    public Optional<ChunkEntity> previousChunk(final String documentId, final int version, final int startOffset) {
        return storage("read neighbour of " + documentId, () -> chunkRepository
                .findFirstByDocumentIdAndVersionAndDeletedFalseAndStartOffsetLessThanOrderByStartOffsetDesc(
                        documentId, version, startOffset));
    }

    /**
     * Closest non-deleted chunk of the same version starting after {@code startOffset}.
     */
    @Transactional(readOnly = true)
    public Optional<ChunkEntity> nextChunk(final String documentId, final int version, final int startOffset) {
        return storage("read neighbour of " + documentId, () -> chunkRepository
                .findFirstByDocumentIdAndVersionAndDeletedFalseAndStartOffsetGreaterThanOrderByStartOffsetAsc(
                        documentId, version, startOffset));
    }

    /**
     * Deletes a document with its versions and chunks.
     *
     * <p>Note: index deletion is performed separately.</p>
     *
     * @return whether the document existed
     */
    @Transactional
    public boolean removeDocument(final String documentId) {
        return storage("remove document " + documentId, () -> {
            if (!documentRepository.existsById(documentId)) {
                return false;
            }
            final int chunks = chunkRepository.deleteByDocumentId(documentId);
            final int versions = versionRepository.deleteByDocumentId(documentId);
            documentRepository.deleteById(documentId);
            documentRepository.flush();
            log.info("Removed document {} from catalog ({} versions, {} chunks)", documentId, versions, chunks);
            return true;
        });
    }

    /**
     * Ids of soft-deleted chunks whose deletion is older than {@code cutoff}.
     */
    @Transactional(readOnly = true)
    public List<String> purgeableChunkIds(final Instant cutoff) {
        return storage("list purgeable chunks", () -> chunkRepository.findPurgeableIds(cutoff));
    }

    /**
     * Physically removes the given chunk rows.
     *
     * @return number of ids processed
     */
    @Transactional
    public int purgeChunks(final List<String> ids) {
        return storage("purge deleted chunks", () -> {
            for (int from = 0; from < ids.size(); from += DELETE_BATCH) {
                chunkRepository.deleteByIdIn(new ArrayList<>(ids.subList(from, Math.min(ids.size(), from + DELETE_BATCH))));
            }
            return ids.size();
        });
    }

    private static <T> T storage(final String action, final Supplier<T> work) {
        try {
            return work.get();
        } catch (final DataAccessException e) {
            throw new StorageException("failed to " + action, e);
        }
    }
}
