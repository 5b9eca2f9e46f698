package eu.virtualparadox.knowledgebase.ingest.chunker;

import eu.virtualparadox.knowledgebase.ingest.model.ChunkDraft;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FixedTokenChunkingStrategyTest {

    private final FixedTokenChunkingStrategy strategy = new FixedTokenChunkingStrategy();

    @Test
    void testWindowsOverlap() {
        final List<ChunkDraft> drafts = strategy.chunk(TextRegion.whole("a b c d e f g h i j", null),
                new ChunkingProfile(0, 4, 1));

        assertThat(drafts).extracting(ChunkDraft::text).containsExactly("a b c d ", "d e f g ", "g h i j");
    }

    @Test
    void testShortTailIsMergedIntoPreviousWindow() {
        final List<ChunkDraft> drafts = strategy.chunk(TextRegion.whole("a b c d e f g h i", null),
                new ChunkingProfile(4, 4, 1));

        assertThat(drafts).extracting(ChunkDraft::text).containsExactly("a b c d ", "d e f g h i");
    }

    @Test
    void testWhitespaceOnlyYieldsNothing() {
        assertThat(strategy.chunk(TextRegion.whole("   ", null), new ChunkingProfile(0, 4, 1))).isEmpty();
    }
}
