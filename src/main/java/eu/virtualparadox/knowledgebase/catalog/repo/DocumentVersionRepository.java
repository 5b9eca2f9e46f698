package eu.virtualparadox.knowledgebase.catalog.repo;

import eu.virtualparadox.knowledgebase.catalog.entity.DocumentVersionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface DocumentVersionRepository extends JpaRepository<DocumentVersionEntity, Long> {

    List<DocumentVersionEntity> findByDocumentIdOrderByVersionAsc(String documentId);

    Optional<DocumentVersionEntity> findByDocumentIdAndVersion(String documentId, int version);

    boolean existsByDocumentIdAndVersion(String documentId, int version);

    @Query("select coalesce(max(v.version), 0) from DocumentVersionEntity v where v.documentId = :documentId")
    int findMaxVersion(@Param("documentId") String documentId);

    @Modifying
    @Query("delete from DocumentVersionEntity v where v.documentId = :documentId")
    int deleteByDocumentId(@Param("documentId") String documentId);
}
