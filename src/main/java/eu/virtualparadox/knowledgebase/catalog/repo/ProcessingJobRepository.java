package eu.virtualparadox.knowledgebase.catalog.repo;

import eu.virtualparadox.knowledgebase.catalog.EJobStatus;
import eu.virtualparadox.knowledgebase.catalog.entity.ProcessingJobEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface ProcessingJobRepository extends JpaRepository<ProcessingJobEntity, String> {

    List<ProcessingJobEntity> findAllByOrderByCreatedAtDesc(Pageable pageable);

    List<ProcessingJobEntity> findByStatusIn(Collection<EJobStatus> statuses);
}
