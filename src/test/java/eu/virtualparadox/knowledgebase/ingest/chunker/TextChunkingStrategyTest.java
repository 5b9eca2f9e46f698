package eu.virtualparadox.knowledgebase.ingest.chunker;

import eu.virtualparadox.knowledgebase.ingest.model.ChunkDraft;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TextChunkingStrategyTest {

    private final TextChunkingStrategy strategy = new TextChunkingStrategy();

    @Test
    void testShortTextIsOneChunk() {
        final String text = "First sentence here. Second one follows.";
        final List<ChunkDraft> drafts = strategy.chunk(TextRegion.whole(text, null), new ChunkingProfile(0, 100, 0));

        assertThat(drafts).hasSize(1);
        assertThat(drafts.get(0).text()).isEqualTo(text);
        assertThat(drafts.get(0).startOffset()).isZero();
        assertThat(drafts.get(0).endOffset()).isEqualTo(text.length());
        assertThat(drafts.get(0).metadata()).containsEntry("strategy", TextChunkingStrategy.NAME);
    }

    @Test
    void testSentencesArePackedUpToMaxTokens() {
        final String text = "Alpha beta gamma. Delta epsilon zeta. Eta theta iota.";
        final List<ChunkDraft> drafts = strategy.chunk(TextRegion.whole(text, null), new ChunkingProfile(0, 8, 0));

        assertThat(drafts).extracting(ChunkDraft::text)
                .containsExactly("Alpha beta gamma. Delta epsilon zeta. ", "Eta theta iota.");
        assertThat(drafts).allSatisfy(d -> assertThat(d.tokenCount()).isLessThanOrEqualTo(8));
    }

    @Test
    void testOverlapRepeatsTrailingSentence() {
        final String text = "Alpha beta gamma. Delta epsilon zeta. Eta theta iota.";
        final List<ChunkDraft> drafts = strategy.chunk(TextRegion.whole(text, null), new ChunkingProfile(0, 8, 4));

        assertThat(drafts).hasSize(2);
        assertThat(drafts.get(1).text()).isEqualTo("Delta epsilon zeta. Eta theta iota.");
    }

    @Test
    void testAbbreviationDoesNotEndSentence() {
        final String text = "Dr. Smith arrived. He left.";
        final List<ChunkDraft> drafts = strategy.chunk(TextRegion.whole(text, null), new ChunkingProfile(0, 5, 0));

        assertThat(drafts).extracting(ChunkDraft::text).containsExactly("Dr. Smith arrived. ", "He left.");
    }

    @Test
    void testOverlongSentenceIsHardSplit() {
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 25; i++) {
            sb.append("word").append(i).append(' ');
        }
        final List<ChunkDraft> drafts = strategy.chunk(TextRegion.whole(sb.toString(), null), new ChunkingProfile(0, 10, 0));

        assertThat(drafts).hasSize(3);
        assertThat(drafts).allSatisfy(d -> assertThat(d.tokenCount()).isLessThanOrEqualTo(10));
        assertThat(drafts.get(2).endOffset()).isEqualTo(sb.length());
    }

    @Test
    void testBlankRegionYieldsNothing() {
        assertThat(strategy.chunk(TextRegion.whole("  \n\n ", null), new ChunkingProfile(0, 10, 0))).isEmpty();
    }
}
