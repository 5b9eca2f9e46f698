package eu.virtualparadox.knowledgebase.catalog.entity;

import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;
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
@Table(name = "documents", indexes = @Index(name = "idx_documents_kb", columnList = "knowledge_base"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentEntity {

    @Id
    @Column(length = 64, nullable = false)
    private String id;

    @Column(name = "knowledge_base", length = 128, nullable = false)
    private String knowledgeBase;

    @Column(length = 1024, nullable = false)
    private String origin;

    @Column(name = "content_hash", length = 64, nullable = false)
    private String contentHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "document_class", length = 16, nullable = false)
    private DocumentClass documentClass;

    @Column(name = "current_version", nullable = false)
    private int currentVersion;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        final Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }
}
