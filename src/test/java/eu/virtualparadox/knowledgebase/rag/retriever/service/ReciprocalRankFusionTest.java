package eu.virtualparadox.knowledgebase.rag.retriever.service;

import eu.virtualparadox.knowledgebase.rag.retriever.model.FusedCandidate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ReciprocalRankFusionTest {

    @Test
    void testRankOneInOneListScoresOneOverSixtyOne() {
        final List<FusedCandidate> fused = ReciprocalRankFusion.fuse(List.of("a"), List.of(), 60);

        assertThat(fused).hasSize(1);
        assertThat(fused.get(0).score()).isCloseTo(1.0 / 61, within(1e-12));
        assertThat(fused.get(0).vectorScore()).isCloseTo(1.0 / 61, within(1e-12));
        assertThat(fused.get(0).lexicalScore()).isZero();
    }

    @Test
    void testRankOneInBothListsScoresTwoOverSixtyOneAndWins() {
        final List<FusedCandidate> fused = ReciprocalRankFusion.fuse(List.of("both", "v"), List.of("both", "l"), 60);

        assertThat(fused.get(0).chunkId()).isEqualTo("both");
        assertThat(fused.get(0).score()).isCloseTo(2.0 / 61, within(1e-12));
        assertThat(fused).extracting(FusedCandidate::chunkId).containsExactly("both", "l", "v");
    }

    @Test
    void testTiesAreBrokenByChunkId() {
        final List<FusedCandidate> fused = ReciprocalRankFusion.fuse(List.of("zeta"), List.of("alpha"), 60);

        assertThat(fused).extracting(FusedCandidate::chunkId).containsExactly("alpha", "zeta");
    }

    @Test
    void testFusionIsDeterministic() {
        final List<String> vector = List.of("c", "a", "b", "d");
        final List<String> lexical = List.of("d", "b", "e");

        final List<FusedCandidate> first = ReciprocalRankFusion.fuse(vector, lexical, 60);
        for (int i = 0; i < 5; i++) {
            assertThat(ReciprocalRankFusion.fuse(vector, lexical, 60)).isEqualTo(first);
        }
    }

    @Test
    void testRepeatedIdKeepsItsBestRank() {
        final List<FusedCandidate> fused = ReciprocalRankFusion.fuse(List.of("a", "a"), null, 10);

        assertThat(fused).hasSize(1);
        assertThat(fused.get(0).score()).isCloseTo(1.0 / 11, within(1e-12));
    }

    @Test
    void testNegativeKIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ReciprocalRankFusion.fuse(List.of(), List.of(), -1));
    }
}
