package eu.virtualparadox.knowledgebase.rag.embed;

import java.util.List;

/**
 * Computes dense vector embeddings for chunk texts and queries.
 * <p>
 * Every vector returned by one instance has exactly {@link #dimensions()} components.
 * Implementations raise {@link eu.virtualparadox.knowledgebase.error.ProviderException}
 * when the backend fails.
 */
public interface EmbeddingService {

    /**
     * Embeds a single query or chunk text.
     *
     * @param text non-blank text
     * @return a dense vector of {@link #dimensions()} components
     */
    float[] embed(String text);

    /**
     * Embeds several texts in one call.
     *
     * @param texts texts to embed
     * @return one vector per text, in input order
     */
    List<float[]> embedBatch(List<String> texts);

    /**
     * @return the fixed dimensionality of produced vectors
     */
    int dimensions();
}
