package eu.virtualparadox.knowledgebase.ingest.chunker;

import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;
import eu.virtualparadox.knowledgebase.ingest.model.ChunkDraft;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Sentence-aware prose chunking.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li><strong>Sentence splitting:</strong> see {@link SentenceSplitter}.</li>
 *   <li><strong>Packing:</strong> sentences are greedily packed into chunks of at most
 *       {@code maxTokens} tokens.</li>
 *   <li><strong>Overlap:</strong> each chunk after the first starts with the trailing
 *       sentences of its predecessor that fit into {@code overlap} tokens.</li>
 *   <li><strong>Long sentence hard-split:</strong> a sentence longer than {@code maxTokens}
 *       is cut into token windows first, so no packed chunk exceeds the bound.</li>
 * </ul>
 * Output is deterministic and the strategy is stateless.
 */
@Component
public class TextChunkingStrategy implements ChunkingStrategy {

    public static final String NAME = "sentences";

    @Override
    public DocumentClass documentClass() {
        return DocumentClass.TEXT;
    }

    @Override
    public String strategyName() {
        return NAME;
    }

    @Override
    public List<ChunkDraft> chunk(final TextRegion region, final ChunkingProfile profile) {
        if (region.isBlank()) {
            return List.of();
        }
        final List<Unit> units = sentenceUnits(region.source(), region.start(), region.end(), profile.maxTokens());
        final List<int[]> groups = UnitPacker.pack(units, profile.minTokens(), profile.maxTokens(),
                UnitPacker.overlapTokens(profile.overlap()));
        return Drafts.fromGroups(region.source(), units, groups, Drafts.meta(NAME));
    }

    /**
     * Sentences of {@code [start, end)} with over-long ones pre-split into token windows.
     */
    static List<Unit> sentenceUnits(final String source, final int start, final int end, final int maxTokens) {
        final List<Unit> units = new ArrayList<>();
        for (final Unit sentence : SentenceSplitter.split(source, start, end)) {
            if (sentence.tokens() > maxTokens) {
                units.addAll(Drafts.tokenWindows(source, sentence.start(), sentence.end(), maxTokens));
            } else {
                units.add(sentence);
            }
        }
        return units;
    }
}
