package eu.virtualparadox.knowledgebase.ingest.chunker;

import eu.virtualparadox.knowledgebase.ingest.model.ChunkDraft;
import eu.virtualparadox.knowledgebase.ingest.model.ChunkMetadata;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TableChunkingStrategyTest {

    private final TableChunkingStrategy strategy = new TableChunkingStrategy();

    @Test
    void testRowsArePackedWithOneRowOverlap() {
        final String csv = "name,age\nalice,31\nbob,42\ncarol,27\ndave,55\n";
        final List<ChunkDraft> drafts = strategy.chunk(TextRegion.whole(csv, "people.csv"), new ChunkingProfile(0, 8, 1));

        assertThat(drafts).hasSize(4);
        assertThat(drafts.get(0).text()).isEqualTo("name,age\nalice,31\n");
        assertThat(drafts.get(1).text()).isEqualTo("alice,31\nbob,42\n");
        assertThat(drafts.get(3).text()).isEqualTo("carol,27\ndave,55\n");
        assertThat(drafts).allSatisfy(d -> {
            assertThat(d.metadata()).containsEntry(ChunkMetadata.TABLE_HEADER, "name,age");
            assertThat(d.metadata()).containsEntry(ChunkMetadata.DELIMITER, ",");
            assertThat(d.text()).endsWith("\n");
        });
        assertThat(drafts.get(0).metadata()).containsEntry(ChunkMetadata.START_LINE, 1);
        assertThat(drafts.get(3).metadata()).containsEntry(ChunkMetadata.END_LINE, 5);
    }

    @Test
    void testSmallTableIsOneChunk() {
        final String table = "| a | b |\n|---|---|\n| 1 | 2 |\n";
        final List<ChunkDraft> drafts = strategy.chunk(TextRegion.whole(table, null), new ChunkingProfile(0, 100, 1));

        assertThat(drafts).hasSize(1);
        assertThat(drafts.get(0).metadata()).containsEntry(ChunkMetadata.DELIMITER, "|");
    }

    @Test
    void testDelimiterDetection() {
        assertThat(TableChunkingStrategy.delimiter("a\tb\tc")).isEqualTo('\t');
        assertThat(TableChunkingStrategy.delimiter("a;b;c")).isEqualTo(';');
        assertThat(TableChunkingStrategy.delimiter("single")).isEqualTo(',');
    }
}
