package eu.virtualparadox.knowledgebase.catalog.entity;

import eu.virtualparadox.knowledgebase.catalog.EJobStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "processing_jobs", indexes = {
        @Index(name = "idx_jobs_status", columnList = "status"),
        @Index(name = "idx_jobs_document", columnList = "document_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProcessingJobEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "document_id", length = 64)
    private String documentId;

    @Column(name = "knowledge_base", length = 128, nullable = false)
    private String knowledgeBase;

    @Column(length = 1024, nullable = false)
    private String origin;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private EJobStatus status;

    @Column(nullable = false)
    private double progress;

    @Column(length = 32, nullable = false)
    private String stage;

    @Column(name = "error_code", length = 32)
    private String errorCode;

    @Column(name = "error_message", length = 2048)
    private String errorMessage;

    /** Version the job produced or kept, {@code null} until it completes. */
    private Integer version;

    @Column(name = "cancel_requested", nullable = false)
    private boolean cancelRequested;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @PrePersist
    void prePersist() {
        final Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
        if (status == null) {
            status = EJobStatus.PENDING;
        }
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }
}
