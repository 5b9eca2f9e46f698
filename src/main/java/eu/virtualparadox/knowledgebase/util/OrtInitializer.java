package eu.virtualparadox.knowledgebase.util;

import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class OrtInitializer {

    private OrtInitializer() {
        // Prevent instantiation
    }

    /**
     * Builds session options for a CPU session.
     *
     * @param intraThreads requested intra-op threads; {@code <= 0} means all cores but one
     */
    public static OrtSession.SessionOptions initializeOrt(final int intraThreads) {
        final int threads = intraThreads > 0
                ? intraThreads
                : Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        try {
            final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();
            opts.setIntraOpNumThreads(threads);
            opts.setInterOpNumThreads(1);
            opts.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);

            log.info("ONNX session options: intra-op threads {}, inter-op threads 1", threads);
            return opts;
        } catch (final OrtException e) {
            throw new IllegalStateException("Failed to initialize ONNX Runtime", e);
        }
    }
}
