package eu.virtualparadox.knowledgebase.ingest.chunker;

import eu.virtualparadox.knowledgebase.application.config.KnowledgeProperties;
import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;
import eu.virtualparadox.knowledgebase.ingest.model.ChunkDraft;
import eu.virtualparadox.knowledgebase.ingest.model.ChunkMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point of chunking: picks the strategy for a document class, segments mixed content,
 * validates the result and falls back to fixed token windows when a strategy fails.
 *
 * <h3>Post-conditions</h3>
 * <ul>
 *   <li>drafts are ordered by start offset and every draft has {@code start < end}</li>
 *   <li>every draft carries at least one token; token-less drafts are merged into a neighbour</li>
 *   <li>the spans cover every non-whitespace character of the content</li>
 * </ul>
 * Ordinals, ids and versions are assigned by the caller.
 */
@Slf4j
@Service
public class ChunkingService {

    private final Map<DocumentClass, ChunkingStrategy> strategies = new EnumMap<>(DocumentClass.class);
    private final FixedTokenChunkingStrategy fallback;
    private final MixedContentSegmenter segmenter;
    private final KnowledgeProperties.Chunking settings;

    public ChunkingService(final List<ChunkingStrategy> strategies,
                           final FixedTokenChunkingStrategy fallback,
                           final MixedContentSegmenter segmenter,
                           final KnowledgeProperties properties) {
        for (final ChunkingStrategy strategy : strategies) {
            if (strategy.documentClass() != null) {
                this.strategies.put(strategy.documentClass(), strategy);
            }
        }
        this.fallback = fallback;
        this.segmenter = segmenter;
        this.settings = properties.getChunking();
    }

    /**
     * Cuts cleaned content into drafts.
     *
     * @param content       cleaned document text
     * @param documentClass class chosen by the classifier
     * @param origin        file name or URL used for language detection, may be {@code null}
     * @return drafts in source order; empty for blank content
     */
    public List<ChunkDraft> chunk(final String content, final DocumentClass documentClass, final String origin) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        final TextRegion whole = TextRegion.whole(content, origin);
        final List<ChunkDraft> drafts = documentClass == DocumentClass.MIXED
                ? chunkMixed(whole)
                : chunkRegion(whole, documentClass, null);
        log.debug("Chunked {} ({}) into {} chunks", origin, documentClass.value(), drafts.size());
        return drafts;
    }

    private List<ChunkDraft> chunkMixed(final TextRegion whole) {
        final List<MixedContentSegmenter.Segment> segments = segmenter.segment(whole);
        final List<ChunkDraft> drafts = new ArrayList<>();
        for (final MixedContentSegmenter.Segment segment : segments) {
            final TextRegion region = new TextRegion(whole.source(), segment.start(), segment.end(), whole.origin());
            if (region.isBlank()) {
                continue;
            }
            drafts.addAll(chunkRegion(region, segment.documentClass(), segment.documentClass()));
        }
        return drafts;
    }

    private List<ChunkDraft> chunkRegion(final TextRegion region,
                                         final DocumentClass documentClass,
                                         final DocumentClass regionClass) {
        final ChunkingStrategy strategy = strategies.get(documentClass);
        List<ChunkDraft> drafts;
        try {
            if (strategy == null) {
                throw new IllegalStateException("no chunking strategy for class " + documentClass.value());
            }
            drafts = normalize(region, strategy.chunk(region, settings.profileFor(documentClass)));
            verify(region, drafts);
        } catch (RuntimeException e) {
            final String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            log.warn("Chunking {} as {} failed, falling back to fixed token windows: {}",
                    region.origin(), documentClass.value(), reason);
            final Map<String, Object> meta = Drafts.meta(FixedTokenChunkingStrategy.NAME);
            meta.put(ChunkMetadata.FALLBACK_REASON, reason);
            drafts = normalize(region, fallback.chunk(region, settings.getFallback(), meta));
        }
        if (regionClass == null) {
            return drafts;
        }
        final List<ChunkDraft> tagged = new ArrayList<>(drafts.size());
        for (final ChunkDraft draft : drafts) {
            final Map<String, Object> meta = new LinkedHashMap<>(draft.metadata());
            meta.put(ChunkMetadata.REGION_CLASS, regionClass.value());
            tagged.add(new ChunkDraft(draft.text(), draft.startOffset(), draft.endOffset(), draft.tokenCount(), meta));
        }
        return tagged;
    }

    /**
     * Orders drafts and folds token-less ones into a neighbour.
     */
    static List<ChunkDraft> normalize(final TextRegion region, final List<ChunkDraft> drafts) {
        final List<ChunkDraft> sorted = new ArrayList<>(drafts);
        sorted.sort(Comparator.comparingInt(ChunkDraft::startOffset).thenComparingInt(ChunkDraft::endOffset));

        final List<ChunkDraft> result = new ArrayList<>(sorted.size());
        ChunkDraft carried = null;
        for (final ChunkDraft draft : sorted) {
            ChunkDraft current = draft;
            if (carried != null) {
                current = Drafts.of(region.source(), carried.startOffset(),
                        Math.max(carried.endOffset(), current.endOffset()), current.metadata());
                carried = null;
            }
            if (current.tokenCount() > 0) {
                result.add(current);
            } else if (!result.isEmpty()) {
                final ChunkDraft previous = result.remove(result.size() - 1);
                result.add(Drafts.of(region.source(), previous.startOffset(),
                        Math.max(previous.endOffset(), current.endOffset()), previous.metadata()));
            } else {
                carried = current;
            }
        }
        return result;
    }

    /**
     * @throws IllegalStateException when a draft is degenerate or content would be lost
     */
    static void verify(final TextRegion region, final List<ChunkDraft> drafts) {
        final String source = region.source();
        int covered = region.start();
        for (final ChunkDraft draft : drafts) {
            if (draft.startOffset() >= draft.endOffset()) {
                throw new IllegalStateException("empty chunk span at offset " + draft.startOffset());
            }
            if (draft.startOffset() < region.start() || draft.endOffset() > region.end()) {
                throw new IllegalStateException("chunk span outside region at offset " + draft.startOffset());
            }
            for (int i = covered; i < draft.startOffset(); i++) {
                if (!Character.isWhitespace(source.charAt(i))) {
                    throw new IllegalStateException("content at offset " + i + " is not covered by any chunk");
                }
            }
            covered = Math.max(covered, draft.endOffset());
        }
        for (int i = covered; i < region.end(); i++) {
            if (!Character.isWhitespace(source.charAt(i))) {
                throw new IllegalStateException("content at offset " + i + " is not covered by any chunk");
            }
        }
    }
}
