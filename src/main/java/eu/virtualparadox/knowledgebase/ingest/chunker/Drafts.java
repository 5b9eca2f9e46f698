package eu.virtualparadox.knowledgebase.ingest.chunker;

import eu.virtualparadox.knowledgebase.ingest.model.ChunkDraft;
import eu.virtualparadox.knowledgebase.ingest.token.TokenCounter;
import eu.virtualparadox.knowledgebase.ingest.token.TokenSpan;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared helpers for building drafts out of source spans.
 */
final class Drafts {

    private Drafts() {
    }

    static ChunkDraft of(final String source, final int start, final int end, final Map<String, Object> metadata) {
        return new ChunkDraft(source.substring(start, end), start, end, TokenCounter.count(source, start, end), metadata);
    }

    static Map<String, Object> meta(final String strategy) {
        final Map<String, Object> m = new LinkedHashMap<>();
        m.put("strategy", strategy);
        return m;
    }

    /**
     * Cuts {@code [start, end)} into contiguous units of at most {@code maxTokens} tokens.
     * Whitespace between two windows belongs to the earlier one.
     */
    static List<Unit> tokenWindows(final String source, final int start, final int end, final int maxTokens) {
        final List<TokenSpan> tokens = TokenCounter.spans(source, start, end);
        final List<Unit> units = new ArrayList<>();
        if (tokens.isEmpty()) {
            units.add(new Unit(start, end, 0));
            return units;
        }
        int unitStart = start;
        for (int i = 0; i < tokens.size(); i += maxTokens) {
            final int next = i + maxTokens;
            final int unitEnd = next < tokens.size() ? tokens.get(next).start() : end;
            units.add(new Unit(unitStart, unitEnd, Math.min(maxTokens, tokens.size() - i)));
            unitStart = unitEnd;
        }
        return units;
    }

    /**
     * Contiguous line units of {@code [start, end)}; each unit owns its line feed.
     */
    static List<Unit> lines(final String source, final int start, final int end) {
        final List<Unit> units = new ArrayList<>();
        int s = start;
        while (s < end) {
            int nl = source.indexOf('\n', s);
            final int e = (nl < 0 || nl >= end) ? end : nl + 1;
            units.add(new Unit(s, e, TokenCounter.count(source, s, e)));
            s = e;
        }
        return units;
    }

    /**
     * Drafts for packed groups, with the given metadata copied into each.
     */
    static List<ChunkDraft> fromGroups(final String source,
                                       final List<Unit> units,
                                       final List<int[]> groups,
                                       final Map<String, Object> metadata) {
        final List<ChunkDraft> drafts = new ArrayList<>(groups.size());
        for (final int[] g : groups) {
            drafts.add(of(source, UnitPacker.start(units, g), UnitPacker.end(units, g), metadata));
        }
        return drafts;
    }
}
