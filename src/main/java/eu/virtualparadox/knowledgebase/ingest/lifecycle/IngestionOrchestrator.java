package eu.virtualparadox.knowledgebase.ingest.lifecycle;

import eu.virtualparadox.knowledgebase.application.config.KnowledgeProperties;
import eu.virtualparadox.knowledgebase.application.executor.IngestionExecutor;
import eu.virtualparadox.knowledgebase.catalog.entity.ChunkEntity;
import eu.virtualparadox.knowledgebase.catalog.entity.DocumentEntity;
import eu.virtualparadox.knowledgebase.catalog.entity.ProcessingJobEntity;
import eu.virtualparadox.knowledgebase.catalog.service.DocumentCatalogService;
import eu.virtualparadox.knowledgebase.catalog.service.ProcessingJobService;
import eu.virtualparadox.knowledgebase.catalog.service.VersionCommit;
import eu.virtualparadox.knowledgebase.error.CancelledException;
import eu.virtualparadox.knowledgebase.error.ConflictException;
import eu.virtualparadox.knowledgebase.error.ErrorCode;
import eu.virtualparadox.knowledgebase.error.KnowledgeBaseException;
import eu.virtualparadox.knowledgebase.error.StorageException;
import eu.virtualparadox.knowledgebase.error.ValidationException;
import eu.virtualparadox.knowledgebase.ingest.chunker.ChunkingService;
import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;
import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClassifier;
import eu.virtualparadox.knowledgebase.ingest.cleaner.TextCleaner;
import eu.virtualparadox.knowledgebase.ingest.model.ChunkDraft;
import eu.virtualparadox.knowledgebase.ingest.model.ChunkMetadata;
import eu.virtualparadox.knowledgebase.rag.embed.EmbeddingService;
import eu.virtualparadox.knowledgebase.rag.index.VectorIndexService;
import eu.virtualparadox.knowledgebase.rag.index.model.IndexedChunk;
import eu.virtualparadox.knowledgebase.util.ContentHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Runs documents through classify, chunk, embed and index, one job per submission.
 * <p>
 * {@link #submit(IngestionRequest)} validates and normalizes the input, records a job and
 * hands the work to the {@link IngestionExecutor}; the caller polls the job. Only one job
 * per document id runs at a time, distinct documents run in parallel.
 *
 * <h3>Write order</h3>
 * <ol>
 *   <li>leftovers under the new version key are dropped, then the new chunks are written
 *   to the index as pending (invisible)</li>
 *   <li>the catalog commits version, chunks and the soft-delete of older chunks in one transaction</li>
 *   <li>the index publishes the new version and retires the old one in one commit</li>
 * </ol>
 * A failure before step 2 discards the pending entries and leaves the previous version
 * searchable. A failure after it is repaired by {@link GarbageCollectionService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionOrchestrator {

    static final String INTERRUPTED = "interrupted by restart";

    private static final Pattern KNOWLEDGE_BASE = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

    private final TextCleaner textCleaner;
    private final DocumentClassifier classifier;
    private final ChunkingService chunkingService;
    private final EmbeddingService embeddingService;
    private final VectorIndexService vectorIndexService;
    private final DocumentCatalogService catalogService;
    private final ProcessingJobService jobService;
    private final InFlightDocuments inFlight;
    private final IngestionExecutor ingestionExecutor;
    private final KnowledgeProperties properties;

    /**
     * Normalized input of a job, fixed at submission.
     */
    private record Work(String jobId,
                        String documentId,
                        String knowledgeBase,
                        String origin,
                        String content,
                        String contentHash,
                        DocumentClass documentClass) {
    }

    /**
     * Queues an ingestion.
     *
     * @return id of the created job
     * @throws ValidationException if the request is malformed; nothing is recorded
     * @throws ConflictException   if a job for the same document is still running, or the queue is full
     */
    public String submit(final IngestionRequest request) {
        if (request == null) {
            throw new ValidationException("request must not be null");
        }
        final String origin = requireOrigin(request.origin());
        final String knowledgeBase = resolveKnowledgeBase(request.knowledgeBase());
        if (request.content() == null) {
            throw new ValidationException("content must not be null");
        }
        if (request.content().length() > properties.getIngestion().getMaxContentChars()) {
            throw new ValidationException("content exceeds " + properties.getIngestion().getMaxContentChars()
                    + " characters");
        }
        final String content = textCleaner.clean(request.content());
        if (content.isBlank()) {
            throw new ValidationException("content must not be blank");
        }
        final String contentHash = resolveHash(request.contentHash(), content);
        final String documentId = ContentHasher.documentId(knowledgeBase, origin);

        if (!inFlight.tryClaim(documentId)) {
            throw new ConflictException("an ingestion job for document " + documentId + " is still running");
        }
        final ProcessingJobEntity job;
        try {
            job = jobService.create(documentId, knowledgeBase, origin, JobStage.RECEIVED.value());
        } catch (final RuntimeException e) {
            inFlight.release(documentId);
            throw e;
        }

        final Work work = new Work(job.getId(), documentId, knowledgeBase, origin, content, contentHash,
                request.documentClass());
        try {
            ingestionExecutor.execute(() -> run(work));
        } catch (final TaskRejectedException e) {
            inFlight.release(documentId);
            jobService.fail(job.getId(), JobStage.RECEIVED.value(), ErrorCode.CONFLICT.getCode(),
                    "ingestion queue is full");
            throw new ConflictException("ingestion queue is full, retry later");
        }
        log.info("Queued ingestion job {} for {} ({} chars)", job.getId(), origin, content.length());
        return job.getId();
    }

    /**
     * Requests cancellation; the job stops at its next stage boundary.
     *
     * @throws eu.virtualparadox.knowledgebase.error.NotFoundException for an unknown job
     */
    public ProcessingJobEntity cancel(final String jobId) {
        final ProcessingJobEntity job = jobService.requestCancel(jobId);
        log.info("Cancellation requested for job {} ({})", jobId, job.getStatus().value());
        return job;
    }

    /**
     * Jobs left open by a previous process can never finish.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void failInterruptedJobs() {
        final int failed = jobService.failUnfinished(ErrorCode.CANCELLED.getCode(), INTERRUPTED);
        if (failed > 0) {
            log.warn("Marked {} unfinished jobs from a previous run as failed", failed);
        }
    }

    private void run(final Work work) {
        final String jobId = work.jobId();
        JobStage stage = JobStage.RECEIVED;
        Integer pendingVersion = null;
        boolean committed = false;
        try {
            log.info("Ingestion job {} started for {}", jobId, work.origin());
            checkCancelled(jobId, stage);

            final Optional<DocumentEntity> existing = catalogService.findDocument(work.documentId());
            if (existing.isPresent() && work.contentHash().equals(existing.get().getContentHash())) {
                jobService.complete(jobId, JobStage.UNCHANGED.value(), existing.get().getCurrentVersion());
                log.info("Ingestion job {}: content of {} unchanged, version {} kept",
                        jobId, work.origin(), existing.get().getCurrentVersion());
                return;
            }

            stage = enter(jobId, JobStage.CLASSIFYING, 0.1);
            final DocumentClass documentClass = work.documentClass() != null
                    ? work.documentClass()
                    : classifier.classify(sample(work.content()), work.origin());

            checkCancelled(jobId, stage);
            stage = enter(jobId, JobStage.CHUNKING, 0.25);
            final List<ChunkDraft> drafts = chunkingService.chunk(work.content(), documentClass, work.origin());
            if (drafts.isEmpty()) {
                throw new IllegalStateException("chunking produced no chunks");
            }

            checkCancelled(jobId, stage);
            stage = enter(jobId, JobStage.EMBEDDING, 0.4);
            final List<float[]> vectors = embed(jobId, drafts);

            checkCancelled(jobId, stage);
            stage = enter(jobId, JobStage.INDEXING, 0.9);
            final int version = catalogService.latestVersion(work.documentId()) + 1;
            final Instant now = Instant.now();
            final List<IndexedChunk> indexed = new ArrayList<>(drafts.size());
            final List<ChunkEntity> chunks = new ArrayList<>(drafts.size());
            for (int ordinal = 0; ordinal < drafts.size(); ordinal++) {
                final ChunkDraft draft = drafts.get(ordinal);
                final String chunkId = ChunkEntity.chunkId(work.documentId(), version, ordinal);
                indexed.add(new IndexedChunk(chunkId, work.documentId(), version, ordinal, draft.text(),
                        draft.startOffset(), draft.endOffset(), documentClass, language(draft),
                        work.knowledgeBase(), work.origin(), now, draft.metadata(), vectors.get(ordinal)));
                chunks.add(ChunkEntity.builder()
                        .id(chunkId)
                        .documentId(work.documentId())
                        .version(version)
                        .ordinal(ordinal)
                        .text(draft.text())
                        .startOffset(draft.startOffset())
                        .endOffset(draft.endOffset())
                        .tokenCount(draft.tokenCount())
                        .metadata(draft.metadata())
                        .build());
            }

            // a crashed attempt may have left entries under the same version key
            vectorIndexService.discardVersion(work.documentId(), version);
            pendingVersion = version;
            vectorIndexService.writePending(indexed);
            checkCancelled(jobId, stage);

            catalogService.commitVersion(new VersionCommit(work.documentId(), work.knowledgeBase(), work.origin(),
                    work.contentHash(), documentClass, version, chunks));
            committed = true;
            vectorIndexService.publish(work.documentId(), version);

            jobService.complete(jobId, JobStage.COMPLETED.value(), version);
            log.info("Ingestion job {} completed: {} version {} as {} with {} chunks",
                    jobId, work.origin(), version, documentClass.value(), chunks.size());
        } catch (final RuntimeException e) {
            final KnowledgeBaseException failure = classify(stage, e);
            if (failure instanceof CancelledException) {
                log.info("Ingestion job {} cancelled during {}", jobId, stage.value());
            } else {
                log.error("Ingestion job {} failed during {}", jobId, stage.value(), e);
            }
            rollback(work, pendingVersion, committed);
            fail(jobId, stage, failure);
        } finally {
            inFlight.release(work.documentId());
        }
    }

    private JobStage enter(final String jobId, final JobStage stage, final double progress) {
        jobService.advance(jobId, stage.value(), progress);
        return stage;
    }

    /**
     * Embeds in batches, moving progress from 0.4 to 0.8.
     */
    private List<float[]> embed(final String jobId, final List<ChunkDraft> drafts) {
        final int batchSize = Math.max(1, properties.getEmbedding().getBatchSize());
        final List<float[]> vectors = new ArrayList<>(drafts.size());
        for (int from = 0; from < drafts.size(); from += batchSize) {
            final int to = Math.min(drafts.size(), from + batchSize);
            final List<String> texts = drafts.subList(from, to).stream().map(ChunkDraft::text).toList();
            final List<float[]> batch = embeddingService.embedBatch(texts);
            if (batch.size() != texts.size()) {
                throw new IllegalStateException("embedder returned " + batch.size() + " vectors for "
                        + texts.size() + " texts");
            }
            vectors.addAll(batch);
            jobService.advance(jobId, JobStage.EMBEDDING.value(), 0.4 + 0.4 * to / drafts.size());
        }
        return vectors;
    }

    private void checkCancelled(final String jobId, final JobStage stage) {
        if (jobService.isCancelRequested(jobId)) {
            throw new CancelledException(stage.value(), "requested by caller");
        }
    }

    /**
     * Pending entries are dropped unless the catalog already committed them; a committed
     * version that failed to publish is published by the next garbage collection pass.
     */
    private void rollback(final Work work, final Integer pendingVersion, final boolean committed) {
        if (pendingVersion == null || committed) {
            return;
        }
        try {
            vectorIndexService.discardVersion(work.documentId(), pendingVersion);
        } catch (final RuntimeException cleanup) {
            log.error("Could not discard pending version {} of {}, garbage collection will retry",
                    pendingVersion, work.documentId(), cleanup);
        }
    }

    private void fail(final String jobId, final JobStage stage, final KnowledgeBaseException failure) {
        try {
            jobService.fail(jobId, stage.value(), failure.getErrorCode().getCode(), failure.getMessage());
        } catch (final RuntimeException e) {
            log.error("Could not record failure of job {}", jobId, e);
        }
    }

    private static KnowledgeBaseException classify(final JobStage stage, final RuntimeException e) {
        if (e instanceof KnowledgeBaseException kbe) {
            return kbe.getStage() == null
                    ? new KnowledgeBaseException(kbe.getErrorCode(), stage.value(), kbe.getMessage(), kbe)
                    : kbe;
        }
        if (e instanceof DataAccessException) {
            return new StorageException(stage.value(), e.getMessage(), e);
        }
        final String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return new KnowledgeBaseException(ErrorCode.INTERNAL, stage.value(), message, e);
    }

    private String sample(final String content) {
        final int limit = Math.max(1, properties.getClassifier().getSampleChars());
        return content.length() <= limit ? content : content.substring(0, limit);
    }

    private static String language(final ChunkDraft draft) {
        final Object language = draft.metadata().get(ChunkMetadata.LANGUAGE);
        return language == null ? null : language.toString().toLowerCase(Locale.ROOT);
    }

    private static String requireOrigin(final String origin) {
        if (origin == null || origin.isBlank()) {
            throw new ValidationException("origin must not be blank");
        }
        if (origin.length() > 1024) {
            throw new ValidationException("origin must not exceed 1024 characters");
        }
        return origin.strip();
    }

    private String resolveKnowledgeBase(final String knowledgeBase) {
        if (knowledgeBase == null || knowledgeBase.isBlank()) {
            return properties.getIngestion().getDefaultKnowledgeBase();
        }
        final String name = knowledgeBase.strip();
        if (!KNOWLEDGE_BASE.matcher(name).matches()) {
            throw new ValidationException("invalid knowledge base name: " + knowledgeBase);
        }
        return name;
    }

    private static String resolveHash(final String supplied, final String content) {
        if (supplied == null || supplied.isBlank()) {
            return ContentHasher.sha256(content);
        }
        final String hash = supplied.strip().toLowerCase(Locale.ROOT);
        if (!hash.matches("[0-9a-f]{64}")) {
            throw new ValidationException("content hash must be 64 hex characters");
        }
        return hash;
    }
}
