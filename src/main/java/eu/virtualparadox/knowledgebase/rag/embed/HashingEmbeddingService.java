package eu.virtualparadox.knowledgebase.rag.embed;

import eu.virtualparadox.knowledgebase.ingest.token.TokenCounter;
import eu.virtualparadox.knowledgebase.ingest.token.TokenSpan;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic, model-free embedder based on signed feature hashing of lower-cased word
 * unigrams and bigrams. Texts sharing vocabulary land close together, which is enough for
 * offline deployments and for tests; it carries no semantics beyond word overlap.
 */
public class HashingEmbeddingService implements EmbeddingService {

    private static final int FNV_OFFSET = 0x811c9dc5;
    private static final int FNV_PRIME = 0x01000193;

    private final int dimensions;

    public HashingEmbeddingService(final int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be > 0");
        }
        this.dimensions = dimensions;
    }

    @Override
    public float[] embed(final String text) {
        final float[] vec = new float[dimensions];
        final List<String> words = words(text == null ? "" : text);
        for (int i = 0; i < words.size(); i++) {
            add(vec, words.get(i), 1.0f);
            if (i > 0) {
                add(vec, words.get(i - 1) + ' ' + words.get(i), 0.5f);
            }
        }
        return Vectors.normalize(vec);
    }

    @Override
    public List<float[]> embedBatch(final List<String> texts) {
        final List<float[]> out = new ArrayList<>(texts.size());
        for (final String text : texts) {
            out.add(embed(text));
        }
        return out;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    private void add(final float[] vec, final String feature, final float weight) {
        final int hash = fnv1a(feature);
        final int bucket = Math.floorMod(hash, dimensions);
        // the top bit picks the sign so collisions tend to cancel out
        vec[bucket] += (hash >>> 31) == 0 ? weight : -weight;
    }

    private static List<String> words(final String text) {
        final List<String> words = new ArrayList<>();
        for (final TokenSpan span : TokenCounter.spans(text, 0, text.length())) {
            final String token = text.substring(span.start(), span.end());
            if (Character.isLetterOrDigit(token.codePointAt(0)) || token.charAt(0) == '_') {
                words.add(token.toLowerCase(Locale.ROOT));
            }
        }
        return words;
    }

    static int fnv1a(final String feature) {
        int hash = FNV_OFFSET;
        for (final byte b : feature.getBytes(StandardCharsets.UTF_8)) {
            hash ^= b & 0xff;
            hash *= FNV_PRIME;
        }
        return hash;
    }
}
