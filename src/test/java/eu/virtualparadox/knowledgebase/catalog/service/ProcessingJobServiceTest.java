package eu.virtualparadox.knowledgebase.catalog.service;

import eu.virtualparadox.knowledgebase.catalog.EJobStatus;
import eu.virtualparadox.knowledgebase.catalog.entity.ProcessingJobEntity;
import eu.virtualparadox.knowledgebase.error.NotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(ProcessingJobService.class)
class ProcessingJobServiceTest {

    @Autowired
    private ProcessingJobService jobService;

    @Test
    void testCreateStartsPending() {
        final ProcessingJobEntity job = jobService.create("doc-1", "kb", "a.md", "received");

        final ProcessingJobEntity stored = jobService.get(job.getId());
        assertThat(stored.getStatus()).isEqualTo(EJobStatus.PENDING);
        assertThat(stored.getProgress()).isZero();
        assertThat(stored.getStage()).isEqualTo("received");
        assertThat(stored.getCreatedAt()).isNotNull();
        assertThat(stored.getVersion()).isNull();
    }

    @Test
    void testProgressNeverDecreases() {
        final String id = jobService.create("doc-1", "kb", "a.md", "received").getId();

        jobService.advance(id, "embedding", 0.4);
        jobService.advance(id, "indexing", 0.2);

        final ProcessingJobEntity job = jobService.get(id);
        assertThat(job.getStatus()).isEqualTo(EJobStatus.PROCESSING);
        assertThat(job.getStage()).isEqualTo("indexing");
        assertThat(job.getProgress()).isEqualTo(0.4);
    }

    @Test
    void testTerminalJobIsNotModified() {
        final String id = jobService.create("doc-1", "kb", "a.md", "received").getId();
        jobService.complete(id, "completed", 2);

        jobService.fail(id, "indexing", "storage_error", "late failure");
        jobService.advance(id, "embedding", 0.5);

        final ProcessingJobEntity job = jobService.get(id);
        assertThat(job.getStatus()).isEqualTo(EJobStatus.COMPLETED);
        assertThat(job.getProgress()).isEqualTo(1.0);
        assertThat(job.getVersion()).isEqualTo(2);
        assertThat(job.getErrorCode()).isNull();
        assertThat(job.getFinishedAt()).isNotNull();
    }

    @Test
    void testFailRecordsStageAndTruncatesMessage() {
        final String id = jobService.create("doc-1", "kb", "a.md", "received").getId();

        jobService.fail(id, "embedding", "provider_error", "x".repeat(5000));

        final ProcessingJobEntity job = jobService.get(id);
        assertThat(job.getStatus()).isEqualTo(EJobStatus.FAILED);
        assertThat(job.getStage()).isEqualTo("embedding");
        assertThat(job.getErrorCode()).isEqualTo("provider_error");
        assertThat(job.getErrorMessage()).hasSize(2048).endsWith("...");
    }

    @Test
    void testCancelRequestOnlyAffectsRunningJobs() {
        final String running = jobService.create("doc-1", "kb", "a.md", "received").getId();
        final String done = jobService.create("doc-2", "kb", "b.md", "received").getId();
        jobService.complete(done, "completed", 1);

        assertThat(jobService.requestCancel(running).isCancelRequested()).isTrue();
        assertThat(jobService.requestCancel(done).isCancelRequested()).isFalse();
        assertThat(jobService.isCancelRequested(running)).isTrue();
        assertThat(jobService.isCancelRequested("unknown")).isFalse();
    }

    @Test
    void testFailUnfinishedSkipsTerminalJobs() {
        final String pending = jobService.create("doc-1", "kb", "a.md", "received").getId();
        final String processing = jobService.create("doc-2", "kb", "b.md", "received").getId();
        jobService.advance(processing, "chunking", 0.25);
        final String done = jobService.create("doc-3", "kb", "c.md", "received").getId();
        jobService.complete(done, "completed", 1);

        assertThat(jobService.failUnfinished("cancelled", "interrupted by restart")).isEqualTo(2);

        assertThat(jobService.get(pending).getStatus()).isEqualTo(EJobStatus.FAILED);
        assertThat(jobService.get(processing).getErrorCode()).isEqualTo("cancelled");
        assertThat(jobService.get(processing).getStage()).isEqualTo("chunking");
        assertThat(jobService.get(done).getStatus()).isEqualTo(EJobStatus.COMPLETED);
    }

    @Test
    void testListIsLimited() {
        jobService.create("doc-1", "kb", "a.md", "received");
        jobService.create("doc-2", "kb", "b.md", "received");
        jobService.create("doc-3", "kb", "c.md", "received");

        assertThat(jobService.list(2)).hasSize(2);
        assertThat(jobService.list(0)).hasSize(1);
        assertThatThrownBy(() -> jobService.get("missing")).isInstanceOf(NotFoundException.class);
    }
}
