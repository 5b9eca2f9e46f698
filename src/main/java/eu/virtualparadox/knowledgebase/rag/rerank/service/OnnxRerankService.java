package eu.virtualparadox.knowledgebase.rag.rerank.service;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.knowledgebase.rag.rerank.model.RerankResult;
import eu.virtualparadox.knowledgebase.rag.retriever.model.SearchResult;
import eu.virtualparadox.knowledgebase.util.OrtInitializer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.LongBuffer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cross-encoder reranker on ONNX Runtime with windowed scoring of long passages.
 * <p>
 * The model accepts at most {@value #MAX_LEN} tokens. A longer query+passage encoding is cut
 * into overlapping windows, each window is scored on its own and the passage keeps the best
 * window score, so content past the truncation point still counts.
 */
@Slf4j
public final class OnnxRerankService implements RerankService, AutoCloseable {

    /** Maximum token length supported by the reranker model. */
    private static final int MAX_LEN = 512;

    /** Size of each sliding window for long passages. */
    private static final int WINDOW_SIZE = 480;

    /** Overlap between windows. */
    private static final int WINDOW_OVERLAP = 50;

    private final OrtEnvironment env;
    private final OrtSession session;
    private final HuggingFaceTokenizer tokenizer;
    private final Set<String> inputNames;

    /**
     * @param modelRoot folder with {@code model.onnx} and {@code tokenizer.json}
     * @param threads   intra-op threads, {@code <= 0} for all cores but one
     */
    public OnnxRerankService(final Path modelRoot, final int threads) {
        final Path modelPath = modelRoot.resolve("model.onnx");
        final Path tokenizerPath = modelRoot.resolve("tokenizer.json");
        try {
            this.env = OrtEnvironment.getEnvironment();
            this.session = env.createSession(modelPath.toString(), OrtInitializer.initializeOrt(threads));
            this.tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);
            this.inputNames = session.getInputNames();
        } catch (final OrtException | IOException e) {
            throw new IllegalStateException("Failed to load ONNX reranker model from " + modelRoot, e);
        }
        log.info("Loaded ONNX reranker model from {}", modelPath);
    }

    @Override
    public List<RerankResult> rerank(final String query, final List<SearchResult> candidates) {
        final List<RerankResult> reranked = new ArrayList<>(candidates.size());
        for (final SearchResult candidate : candidates) {
            final Encoding encoding = tokenizer.encode(query, candidate.text());
            try {
                final float score = encoding.getIds().length > MAX_LEN
                        ? scoreWindows(encoding)
                        : score(encoding.getIds(), encoding.getAttentionMask(), encoding.getTypeIds());
                reranked.add(new RerankResult(candidate, score));
            } catch (final OrtException e) {
                throw new IllegalStateException("Failed reranking candidate " + candidate.chunkId(), e);
            }
        }
        reranked.sort(Comparator.comparingDouble(RerankResult::score).reversed()
                .thenComparing(r -> r.result().chunkId()));
        return reranked;
    }

    /**
     * @return best relevance score among all windows of a long encoding
     */
    private float scoreWindows(final Encoding encoding) throws OrtException {
        final long[] ids = encoding.getIds();
        final long[] mask = encoding.getAttentionMask();
        final long[] types = encoding.getTypeIds();

        float best = Float.NEGATIVE_INFINITY;
        for (int start = 0; start < ids.length; start += WINDOW_SIZE - WINDOW_OVERLAP) {
            final int end = Math.min(start + WINDOW_SIZE, ids.length);
            final float score = score(Arrays.copyOfRange(ids, start, end),
                    Arrays.copyOfRange(mask, start, end),
                    Arrays.copyOfRange(types, start, end));
            best = Math.max(best, score);
            if (end == ids.length) {
                break;
            }
        }
        return best;
    }

    /**
     * Runs the model on one padded sequence and extracts the relevance logit.
     */
    private float score(final long[] ids, final long[] mask, final long[] types) throws OrtException {
        final long[] shape = {1, MAX_LEN};
        try (OnnxTensor inputIds = OnnxTensor.createTensor(env, LongBuffer.wrap(pad(ids)), shape);
             OnnxTensor attentionMask = OnnxTensor.createTensor(env, LongBuffer.wrap(pad(mask)), shape);
             OnnxTensor tokenTypes = OnnxTensor.createTensor(env, LongBuffer.wrap(pad(types)), shape)) {

            final Map<String, OnnxTensor> inputs = new HashMap<>();
            inputs.put("input_ids", inputIds);
            inputs.put("attention_mask", attentionMask);
            if (inputNames.contains("token_type_ids")) {
                inputs.put("token_type_ids", tokenTypes);
            }

            try (OrtSession.Result result = session.run(inputs)) {
                final Object value = result.get(0).getValue();
                if (value instanceof float[][] logits2d) {
                    // [batch, num_labels]: a single regression score or [not relevant, relevant]
                    return logits2d[0].length == 1 ? logits2d[0][0] : logits2d[0][1];
                }
                if (value instanceof float[] logits1d) {
                    return logits1d[0];
                }
                throw new IllegalStateException("Unexpected output shape: " + value.getClass());
            }
        }
    }

    private static long[] pad(final long[] values) {
        return Arrays.copyOf(values, MAX_LEN);
    }

    @Override
    public void close() {
        try {
            session.close();
        } catch (final OrtException e) {
            log.warn("Failed to close ONNX reranker session", e);
        }
        tokenizer.close();
    }
}
