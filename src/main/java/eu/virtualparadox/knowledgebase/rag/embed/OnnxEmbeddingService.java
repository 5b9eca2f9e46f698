package eu.virtualparadox.knowledgebase.rag.embed;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.knowledgebase.util.OrtInitializer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Local sentence embedder running a BERT-style ONNX model.
 * <p>
 * Expects {@code model.onnx} and {@code tokenizer.json} in the model folder. Token vectors
 * are mean-pooled over the attention mask and L2-normalized. The model is probed once at
 * start-up so that a dimension mismatch with the configured index fails fast.
 */
@Slf4j
public final class OnnxEmbeddingService implements EmbeddingService, AutoCloseable {

    private static final int MAX_LEN = 512;

    private final OrtEnvironment env;
    private final OrtSession session;
    private final HuggingFaceTokenizer tokenizer;
    private final Set<String> inputNames;
    private final int dimensions;

    /**
     * @param modelRoot  folder with {@code model.onnx} and {@code tokenizer.json}
     * @param dimensions expected output dimensionality
     * @param threads    intra-op threads, {@code <= 0} for all cores but one
     * @throws IllegalStateException if the model cannot be loaded or its output size differs
     */
    public OnnxEmbeddingService(final Path modelRoot, final int dimensions, final int threads) {
        final Path modelPath = modelRoot.resolve("model.onnx");
        final Path tokenizerPath = modelRoot.resolve("tokenizer.json");
        try {
            this.env = OrtEnvironment.getEnvironment();
            this.session = env.createSession(modelPath.toString(), OrtInitializer.initializeOrt(threads));
            this.tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);
            this.inputNames = session.getInputNames();
        } catch (final OrtException | IOException e) {
            throw new IllegalStateException("Failed to load ONNX embedding model from " + modelRoot, e);
        }
        this.dimensions = dimensions;

        log.info("Loaded ONNX embedding model: {}", modelPath);
        log.info("Model expects inputs: {}", inputNames);

        final int actual = run(List.of("dimension probe")).get(0).length;
        if (actual != dimensions) {
            close();
            throw new IllegalStateException("Embedding model produces " + actual
                    + " dimensions but " + dimensions + " are configured");
        }
    }

    @Override
    public float[] embed(final String text) {
        return run(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedBatch(final List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        return run(texts);
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    private List<float[]> run(final List<String> texts) {
        final List<Encoding> encodings = new ArrayList<>(texts.size());
        int maxLen = 0;
        for (final String text : texts) {
            final Encoding e = tokenizer.encode(text);
            encodings.add(e);
            maxLen = Math.max(maxLen, e.getIds().length);
        }
        maxLen = Math.min(maxLen, MAX_LEN);

        final int batchSize = encodings.size();
        final long[][] inputIdArr = new long[batchSize][maxLen];
        final long[][] attnMaskArr = new long[batchSize][maxLen];
        final long[][] tokenTypeArr = new long[batchSize][maxLen];
        for (int i = 0; i < batchSize; i++) {
            final long[] ids = encodings.get(i).getIds();
            final long[] mask = encodings.get(i).getAttentionMask();
            final int len = Math.min(ids.length, maxLen);
            System.arraycopy(ids, 0, inputIdArr[i], 0, len);
            System.arraycopy(mask, 0, attnMaskArr[i], 0, len);
        }

        try (OnnxTensor inputIds = OnnxTensor.createTensor(env, inputIdArr);
             OnnxTensor attentionMask = OnnxTensor.createTensor(env, attnMaskArr);
             OnnxTensor tokenTypes = OnnxTensor.createTensor(env, tokenTypeArr)) {

            final Map<String, OnnxTensor> inputs = new HashMap<>();
            if (inputNames.contains("input_ids")) {
                inputs.put("input_ids", inputIds);
            }
            if (inputNames.contains("attention_mask")) {
                inputs.put("attention_mask", attentionMask);
            }
            if (inputNames.contains("token_type_ids")) {
                inputs.put("token_type_ids", tokenTypes);
            }

            try (OrtSession.Result result = session.run(inputs)) {
                final float[][][] hidden = (float[][][]) result.get(0).getValue();
                final List<float[]> out = new ArrayList<>(batchSize);
                for (int i = 0; i < batchSize; i++) {
                    out.add(Vectors.normalize(meanPool(hidden[i], attnMaskArr[i])));
                }
                return out;
            }
        } catch (final OrtException e) {
            throw new IllegalStateException("Failed to embed batch of " + batchSize, e);
        }
    }

    private static float[] meanPool(final float[][] tokenVectors, final long[] attentionMask) {
        final int hiddenDim = tokenVectors[0].length;
        final float[] pooled = new float[hiddenDim];
        int valid = 0;
        for (int i = 0; i < tokenVectors.length && i < attentionMask.length; i++) {
            if (attentionMask[i] == 1) {
                for (int j = 0; j < hiddenDim; j++) {
                    pooled[j] += tokenVectors[i][j];
                }
                valid++;
            }
        }
        if (valid > 0) {
            for (int j = 0; j < hiddenDim; j++) {
                pooled[j] /= valid;
            }
        }
        return pooled;
    }

    @Override
    public void close() {
        try {
            session.close();
        } catch (final OrtException e) {
            log.warn("Failed to close ONNX embedding session", e);
        }
        tokenizer.close();
    }
}
