package eu.virtualparadox.knowledgebase.rag.embed;

/**
 * Small vector helpers shared by the embedding backends.
 */
final class Vectors {

    private Vectors() {
        // prevent instantiation
    }

    /**
     * Scales {@code vec} to unit length in place. A zero vector becomes the first basis vector
     * so that cosine and dot-product similarities stay defined.
     */
    static float[] normalize(final float[] vec) {
        double norm = 0.0;
        for (final float v : vec) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm > 0.0) {
            for (int i = 0; i < vec.length; i++) {
                vec[i] /= (float) norm;
            }
        } else if (vec.length > 0) {
            vec[0] = 1.0f;
        }
        return vec;
    }
}
