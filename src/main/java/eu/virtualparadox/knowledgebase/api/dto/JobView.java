package eu.virtualparadox.knowledgebase.api.dto;

import eu.virtualparadox.knowledgebase.catalog.EJobStatus;
import eu.virtualparadox.knowledgebase.catalog.entity.ProcessingJobEntity;

import java.time.Instant;

public record JobView(String jobId,
                      String documentId,
                      String knowledgeBase,
                      String origin,
                      EJobStatus status,
                      double progress,
                      String stage,
                      String errorCode,
                      String error,
                      Integer version,
                      boolean cancelRequested,
                      Instant createdAt,
                      Instant finishedAt) {

    public static JobView of(final ProcessingJobEntity job) {
        return new JobView(job.getId(), job.getDocumentId(), job.getKnowledgeBase(), job.getOrigin(),
                job.getStatus(), job.getProgress(), job.getStage(), job.getErrorCode(), job.getErrorMessage(),
                job.getVersion(), job.isCancelRequested(), job.getCreatedAt(), job.getFinishedAt());
    }
}
