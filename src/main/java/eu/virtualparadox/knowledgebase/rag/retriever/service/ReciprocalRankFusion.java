package eu.virtualparadox.knowledgebase.rag.retriever.service;

import eu.virtualparadox.knowledgebase.rag.retriever.model.FusedCandidate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reciprocal Rank Fusion of a vector and a lexical ranking.
 * <p>
 * A chunk at 1-based rank {@code r} of a list contributes {@code 1 / (k + r)}; its fused score
 * is the sum over both lists, a list it is absent from contributes nothing. Results are
 * ordered by descending score, exact ties by ascending chunk id, so the output depends only
 * on the two input rankings.
 */
public final class ReciprocalRankFusion {

    public static final int DEFAULT_K = 60;

    private static final Comparator<FusedCandidate> ORDER = Comparator
            .comparingDouble(FusedCandidate::score).reversed()
            .thenComparing(FusedCandidate::chunkId);

    private ReciprocalRankFusion() {
        // prevent instantiation
    }

    /**
     * @param vectorRanking  chunk ids by descending vector similarity
     * @param lexicalRanking chunk ids by descending BM25 score
     * @param k              smoothing constant, must be {@code >= 0}
     */
    public static List<FusedCandidate> fuse(final List<String> vectorRanking,
                                            final List<String> lexicalRanking,
                                            final int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must be >= 0");
        }
        final Map<String, Double> vector = contributions(vectorRanking, k);
        final Map<String, Double> lexical = contributions(lexicalRanking, k);

        final Set<String> ids = new HashSet<>(vector.keySet());
        ids.addAll(lexical.keySet());

        final List<FusedCandidate> fused = new ArrayList<>(ids.size());
        for (final String id : ids) {
            final double v = vector.getOrDefault(id, 0.0);
            final double l = lexical.getOrDefault(id, 0.0);
            fused.add(new FusedCandidate(id, v + l, v, l));
        }
        fused.sort(ORDER);
        return fused;
    }

    private static Map<String, Double> contributions(final List<String> ranking, final int k) {
        final Map<String, Double> contributions = new LinkedHashMap<>();
        if (ranking == null) {
            return contributions;
        }
        int rank = 0;
        for (final String id : ranking) {
            rank++;
            // a repeated id keeps its best rank
            contributions.putIfAbsent(id, 1.0 / (k + rank));
        }
        return contributions;
    }
}
