package eu.virtualparadox.knowledgebase.api;

import eu.virtualparadox.knowledgebase.api.dto.IngestRequest;
import eu.virtualparadox.knowledgebase.api.dto.IngestResponse;
import eu.virtualparadox.knowledgebase.api.dto.JobView;
import eu.virtualparadox.knowledgebase.catalog.service.ProcessingJobService;
import eu.virtualparadox.knowledgebase.ingest.lifecycle.IngestionOrchestrator;
import eu.virtualparadox.knowledgebase.ingest.lifecycle.IngestionRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Ingestion entry point and job tracking.
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class IngestionController {

    private final IngestionOrchestrator orchestrator;
    private final ProcessingJobService jobService;

    /**
     * Queues the content for ingestion and answers with the job to poll.
     */
    @PostMapping("/ingest")
    public ResponseEntity<IngestResponse> ingest(@Valid @RequestBody final IngestRequest request) {
        final String jobId = orchestrator.submit(new IngestionRequest(request.content(), request.origin(),
                request.knowledgeBase(), request.contentHash(), request.documentClass()));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new IngestResponse(jobId));
    }

    @GetMapping("/jobs/{id}")
    public JobView job(@PathVariable("id") final String id) {
        return JobView.of(jobService.get(id));
    }

    @GetMapping("/jobs")
    public List<JobView> jobs(@RequestParam(name = "limit", defaultValue = "50") @Min(1) @Max(1000) final int limit) {
        return jobService.list(limit).stream().map(JobView::of).toList();
    }

    @PostMapping("/jobs/{id}/cancel")
    public JobView cancel(@PathVariable("id") final String id) {
        return JobView.of(orchestrator.cancel(id));
    }
}
