package eu.virtualparadox.knowledgebase.ingest.chunker;

import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;
import eu.virtualparadox.knowledgebase.ingest.model.ChunkDraft;
import eu.virtualparadox.knowledgebase.ingest.token.TokenCounter;
import eu.virtualparadox.knowledgebase.ingest.token.TokenSpan;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Generic fixed-size token windows with token overlap. Used for languages without a
 * structural parser and as the fallback whenever a class strategy fails.
 */
@Component
public class FixedTokenChunkingStrategy implements ChunkingStrategy {

    public static final String NAME = "fixed-tokens";

    @Override
    public DocumentClass documentClass() {
        return null;
    }

    @Override
    public String strategyName() {
        return NAME;
    }

    @Override
    public List<ChunkDraft> chunk(final TextRegion region, final ChunkingProfile profile) {
        return chunk(region, profile, Drafts.meta(NAME));
    }

    /**
     * Same as {@link #chunk(TextRegion, ChunkingProfile)} with caller-supplied metadata.
     */
    public List<ChunkDraft> chunk(final TextRegion region,
                                  final ChunkingProfile profile,
                                  final Map<String, Object> metadata) {
        final String source = region.source();
        final List<TokenSpan> tokens = TokenCounter.spans(source, region.start(), region.end());
        final List<int[]> windows = new ArrayList<>();
        if (tokens.isEmpty()) {
            return List.of();
        }

        final int max = profile.maxTokens();
        final int step = Math.max(1, max - profile.overlap());
        final int n = tokens.size();
        for (int s = 0; ; s += step) {
            final int e = Math.min(s + max, n);
            windows.add(new int[]{s, e});
            if (e == n) {
                break;
            }
        }

        if (windows.size() > 1) {
            final int[] last = windows.get(windows.size() - 1);
            if (last[1] - last[0] < profile.minTokens()) {
                windows.remove(windows.size() - 1);
                windows.get(windows.size() - 1)[1] = n;
            }
        }

        final List<ChunkDraft> drafts = new ArrayList<>(windows.size());
        for (int w = 0; w < windows.size(); w++) {
            final int[] window = windows.get(w);
            final int start = w == 0 ? region.start() : tokens.get(window[0]).start();
            final int end = window[1] < n ? tokens.get(window[1]).start() : region.end();
            drafts.add(Drafts.of(source, start, end, metadata));
        }
        return drafts;
    }
}
