package eu.virtualparadox.knowledgebase.catalog.service;

import eu.virtualparadox.knowledgebase.catalog.EJobStatus;
import eu.virtualparadox.knowledgebase.catalog.entity.ProcessingJobEntity;
import eu.virtualparadox.knowledgebase.catalog.repo.ProcessingJobRepository;
import eu.virtualparadox.knowledgebase.error.NotFoundException;
import eu.virtualparadox.knowledgebase.error.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Persistent job records. Every update runs in its own short transaction so that a reader
 * polling a job sees each stage as soon as it is entered.
 * <p>
 * Terminal jobs are never modified again, and progress never decreases.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProcessingJobService {

    private final ProcessingJobRepository repository;

    @Transactional
    public ProcessingJobEntity create(final String documentId,
                                      final String knowledgeBase,
                                      final String origin,
                                      final String stage) {
        try {
            return repository.save(ProcessingJobEntity.builder()
                    .id(UUID.randomUUID().toString())
                    .documentId(documentId)
                    .knowledgeBase(knowledgeBase)
                    .origin(origin)
                    .status(EJobStatus.PENDING)
                    .progress(0.0)
                    .stage(stage)
                    .build());
        } catch (final DataAccessException e) {
            throw new StorageException("failed to create job for " + origin, e);
        }
    }

    /**
     * @throws NotFoundException for an unknown id
     */
    @Transactional(readOnly = true)
    public ProcessingJobEntity get(final String jobId) {
        return repository.findById(jobId).orElseThrow(() -> new NotFoundException("job", jobId));
    }

    /**
     * @return most recent jobs first
     */
    @Transactional(readOnly = true)
    public List<ProcessingJobEntity> list(final int limit) {
        return repository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    /**
     * Moves the job into {@code stage}, raising progress to at least {@code progress}.
     */
    @Transactional
    public void advance(final String jobId, final String stage, final double progress) {
        update(jobId, job -> {
            job.setStatus(EJobStatus.PROCESSING);
            job.setStage(stage);
            job.setProgress(Math.max(job.getProgress(), clamp(progress)));
        });
    }

    @Transactional
    public void complete(final String jobId, final String stage, final Integer version) {
        update(jobId, job -> {
            job.setStatus(EJobStatus.COMPLETED);
            job.setStage(stage);
            job.setProgress(1.0);
            job.setVersion(version);
            job.setFinishedAt(Instant.now());
        });
    }

    /**
     * @param stage stage that was running when the job failed
     */
    @Transactional
    public void fail(final String jobId, final String stage, final String errorCode, final String message) {
        update(jobId, job -> {
            job.setStatus(EJobStatus.FAILED);
            job.setStage(stage);
            job.setErrorCode(errorCode);
            job.setErrorMessage(truncate(message));
            job.setFinishedAt(Instant.now());
        });
    }

    /**
     * Flags the job for cancellation; the worker stops at its next stage boundary.
     *
     * @return the job after the request; terminal jobs are returned unchanged
     */
    @Transactional
    public ProcessingJobEntity requestCancel(final String jobId) {
        final ProcessingJobEntity job = get(jobId);
        if (!job.getStatus().isTerminal()) {
            job.setCancelRequested(true);
            repository.save(job);
        }
        return job;
    }

    @Transactional(readOnly = true)
    public boolean isCancelRequested(final String jobId) {
        return repository.findById(jobId).map(ProcessingJobEntity::isCancelRequested).orElse(false);
    }

    /**
     * Fails every non-terminal job, used at startup when no worker can own them any more.
     *
     * @return number of jobs failed
     */
    @Transactional
    public int failUnfinished(final String errorCode, final String reason) {
        final List<ProcessingJobEntity> open =
                repository.findByStatusIn(EnumSet.of(EJobStatus.PENDING, EJobStatus.PROCESSING));
        final Instant now = Instant.now();
        for (final ProcessingJobEntity job : open) {
            job.setStatus(EJobStatus.FAILED);
            job.setErrorCode(errorCode);
            job.setErrorMessage(reason);
            job.setFinishedAt(now);
        }
        repository.saveAll(open);
        return open.size();
    }

    private void update(final String jobId, final Consumer<ProcessingJobEntity> change) {
        try {
            repository.findById(jobId).ifPresentOrElse(job -> {
                if (job.getStatus().isTerminal()) {
                    log.debug("Ignoring update of terminal job {}", jobId);
                    return;
                }
                change.accept(job);
                repository.save(job);
            }, () -> log.warn("Job {} vanished before it could be updated", jobId));
        } catch (final DataAccessException e) {
            throw new StorageException("failed to update job " + jobId, e);
        }
    }

    private static double clamp(final double progress) {
        return Math.max(0.0, Math.min(1.0, progress));
    }

    private static String truncate(final String message) {
        if (message == null || message.length() <= 2048) {
            return message;
        }
        return message.substring(0, 2045) + "...";
    }
}
