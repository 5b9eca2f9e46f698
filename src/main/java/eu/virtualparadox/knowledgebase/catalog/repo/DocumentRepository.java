package eu.virtualparadox.knowledgebase.catalog.repo;

import eu.virtualparadox.knowledgebase.catalog.entity.DocumentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface DocumentRepository extends JpaRepository<DocumentEntity, String> {

    List<DocumentEntity> findAllByOrderByKnowledgeBaseAscOriginAsc();

    List<DocumentEntity> findByKnowledgeBaseOrderByOriginAsc(String knowledgeBase);

    @Query("select d.id from DocumentEntity d where d.knowledgeBase = :kb")
    List<String> findIdsByKnowledgeBase(@Param("kb") String knowledgeBase);
}
