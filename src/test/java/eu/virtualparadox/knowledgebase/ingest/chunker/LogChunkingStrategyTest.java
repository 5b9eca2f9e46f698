package eu.virtualparadox.knowledgebase.ingest.chunker;

import eu.virtualparadox.knowledgebase.ingest.model.ChunkDraft;
import eu.virtualparadox.knowledgebase.ingest.model.ChunkMetadata;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LogChunkingStrategyTest {

    private static final String LOG = String.join("\n",
            "2024-01-01 10:00:00 ERROR boom",
            "  at a.b(C.java:1)",
            "  at d.e(F.java:2)",
            "2024-01-01 10:00:05 INFO recovered",
            "");

    private final LogChunkingStrategy strategy = new LogChunkingStrategy();

    @Test
    void testTimestampsAndLineRangeInMetadata() {
        final List<ChunkDraft> drafts = strategy.chunk(TextRegion.whole(LOG, "app.log"), new ChunkingProfile(0, 200, 0));

        assertThat(drafts).hasSize(1);
        assertThat(drafts.get(0).metadata())
                .containsEntry(ChunkMetadata.FIRST_TIMESTAMP, "2024-01-01 10:00:00")
                .containsEntry(ChunkMetadata.LAST_TIMESTAMP, "2024-01-01 10:00:05")
                .containsEntry(ChunkMetadata.START_LINE, 1)
                .containsEntry(ChunkMetadata.END_LINE, 4);
    }

    @Test
    void testStackTraceStaysWithItsEntry() {
        final List<ChunkDraft> drafts = strategy.chunk(TextRegion.whole(LOG, "app.log"), new ChunkingProfile(0, 35, 0));

        assertThat(drafts).hasSize(2);
        assertThat(drafts.get(0).text()).startsWith("2024-01-01 10:00:00").contains("F.java:2");
        assertThat(drafts.get(1).text()).isEqualTo("2024-01-01 10:00:05 INFO recovered\n");
    }
}
