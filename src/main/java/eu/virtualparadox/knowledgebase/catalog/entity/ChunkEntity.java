package eu.virtualparadox.knowledgebase.catalog.entity;

import eu.virtualparadox.knowledgebase.catalog.converter.MetadataConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Lob;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;

/**
 * A retrievable span of one document version. Superseded chunks are flagged
 * {@code deleted} and purged by garbage collection once past retention.
 */
@Entity
@Table(name = "chunks", indexes = {
        @Index(name = "idx_chunks_doc_version", columnList = "document_id, version"),
        @Index(name = "idx_chunks_deleted", columnList = "deleted")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChunkEntity {

    @Id
    @Column(length = 96, nullable = false)
    private String id;

    @Column(name = "document_id", length = 64, nullable = false)
    private String documentId;

    @Column(nullable = false)
    private int version;

    @Column(name = "version_id", nullable = false)
    private Long versionId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "version_id", insertable = false, updatable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private DocumentVersionEntity documentVersion;

    @Column(nullable = false)
    private int ordinal;

    @Lob
    @Column(nullable = false)
    @ToString.Exclude
    private String text;

    @Column(name = "start_offset", nullable = false)
    private int startOffset;

    @Column(name = "end_offset", nullable = false)
    private int endOffset;

    @Column(name = "token_count", nullable = false)
    private int tokenCount;

    @Lob
    @Convert(converter = MetadataConverter.class)
    private Map<String, Object> metadata;

    @Column(nullable = false)
    private boolean deleted;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /**
     * Chunk ids are stable for a (document, version, ordinal) triple.
     */
    public static String chunkId(final String documentId, final int version, final int ordinal) {
        return documentId + ":" + version + ":" + ordinal;
    }
}
