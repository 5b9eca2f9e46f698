package eu.virtualparadox.knowledgebase.catalog.repo;

import eu.virtualparadox.knowledgebase.catalog.entity.ChunkEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ChunkRepository extends JpaRepository<ChunkEntity, String> {

    List<ChunkEntity> findByDocumentIdOrderByVersionAscOrdinalAsc(String documentId);

    List<ChunkEntity> findByDocumentIdAndDeletedFalseOrderByOrdinalAsc(String documentId);

    List<ChunkEntity> findByDocumentIdAndVersionAndDeletedFalseOrderByOrdinalAsc(String documentId, int version);

    Optional<ChunkEntity> findFirstByDocumentIdAndVersionAndDeletedFalseAndStartOffsetLessThanOrderByStartOffsetDesc(
            String documentId, int version, int startOffset);

    Optional<ChunkEntity> findFirstByDocumentIdAndVersionAndDeletedFalseAndStartOffsetGreaterThanOrderByStartOffsetAsc(
            String documentId, int version, int startOffset);

    long countByDocumentIdAndDeletedFalse(String documentId);

    @Modifying
    @Query("update ChunkEntity c set c.deleted = true, c.deletedAt = :now "
            + "where c.documentId = :documentId and c.version <> :version and c.deleted = false")
    int softDeleteOtherVersions(@Param("documentId") String documentId,
                                @Param("version") int version,
                                @Param("now") Instant now);

    @Query("select c.id from ChunkEntity c where c.deleted = true and c.deletedAt < :cutoff")
    List<String> findPurgeableIds(@Param("cutoff") Instant cutoff);

    @Modifying
    @Query("delete from ChunkEntity c where c.id in :ids")
    int deleteByIdIn(@Param("ids") Collection<String> ids);

    @Modifying
    @Query("delete from ChunkEntity c where c.documentId = :documentId")
    int deleteByDocumentId(@Param("documentId") String documentId);
}
