package eu.virtualparadox.knowledgebase.rag.embed;

import lombok.RequiredArgsConstructor;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingRequest;
import org.springframework.ai.embedding.EmbeddingResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * Embeddings from a Spring AI {@link EmbeddingModel} (Ollama by default).
 * Failures surface as the provider's exceptions; retries are applied by the caller.
 */
@RequiredArgsConstructor
public class RemoteEmbeddingService implements EmbeddingService {

    private final EmbeddingModel embeddingModel;
    private final int dimensions;

    @Override
    public float[] embed(final String text) {
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedBatch(final List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        final EmbeddingResponse response = embeddingModel.call(new EmbeddingRequest(texts, null));
        if (response.getResults().size() != texts.size()) {
            throw new IllegalStateException("embedding model returned " + response.getResults().size()
                    + " vectors for " + texts.size() + " texts");
        }
        final List<float[]> out = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            out.add(Vectors.normalize(response.getResults().get(i).getOutput().clone()));
        }
        return out;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }
}
