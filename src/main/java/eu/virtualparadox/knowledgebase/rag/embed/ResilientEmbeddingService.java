package eu.virtualparadox.knowledgebase.rag.embed;

import eu.virtualparadox.knowledgebase.error.ProviderException;
import eu.virtualparadox.knowledgebase.error.ValidationException;
import eu.virtualparadox.knowledgebase.util.ProviderCalls;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Semaphore;

/**
 * Decorates an embedding backend with the behaviour every caller relies on:
 * <ul>
 *   <li>inputs are split into batches of at most {@code batchSize}</li>
 *   <li>at most {@code maxConcurrency} batch calls run at the same time across all jobs, and
 *   separately at most {@code maxConcurrency} single-text (query) calls, so neither waits on the other</li>
 *   <li>a failed call is retried once after a backoff, then surfaces as {@link ProviderException}</li>
 *   <li>vector count and dimensionality are verified</li>
 * </ul>
 */
@Slf4j
public class ResilientEmbeddingService implements EmbeddingService, AutoCloseable {

    static final String STAGE = "embedding";

    private final EmbeddingService delegate;
    private final Semaphore batchPermits;
    private final Semaphore queryPermits;
    private final int batchSize;
    private final Duration retryBackoff;

    public ResilientEmbeddingService(final EmbeddingService delegate,
                                     final int batchSize,
                                     final int maxConcurrency,
                                     final Duration retryBackoff) {
        if (batchSize <= 0 || maxConcurrency <= 0) {
            throw new IllegalArgumentException("batchSize and maxConcurrency must be > 0");
        }
        this.delegate = delegate;
        this.batchPermits = new Semaphore(maxConcurrency, true);
        this.queryPermits = new Semaphore(maxConcurrency, true);
        this.batchSize = batchSize;
        this.retryBackoff = retryBackoff;
    }

    @Override
    public float[] embed(final String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("text to embed must not be blank");
        }
        return call(List.of(text), queryPermits).get(0);
    }

    @Override
    public List<float[]> embedBatch(final List<String> texts) {
        final List<float[]> out = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += batchSize) {
            out.addAll(call(texts.subList(from, Math.min(texts.size(), from + batchSize)), batchPermits));
        }
        return out;
    }

    @Override
    public int dimensions() {
        return delegate.dimensions();
    }

    private List<float[]> call(final List<String> batch, final Semaphore permits) {
        final List<float[]> vectors = ProviderCalls.withRetry(STAGE, retryBackoff, () -> {
            acquire(permits);
            try {
                return delegate.embedBatch(batch);
            } finally {
                permits.release();
            }
        });
        if (vectors.size() != batch.size()) {
            throw new ProviderException(STAGE, "expected " + batch.size() + " vectors, got " + vectors.size(), null);
        }
        for (final float[] vector : vectors) {
            if (vector == null || vector.length != dimensions()) {
                throw new ProviderException(STAGE, "expected vectors of " + dimensions() + " dimensions, got "
                        + (vector == null ? "null" : vector.length), null);
            }
        }
        return vectors;
    }

    private static void acquire(final Semaphore permits) {
        try {
            permits.acquire();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(STAGE, "interrupted while waiting for an embedding slot", e);
        }
    }

    @Override
    public void close() {
        if (delegate instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (final Exception e) {
                log.warn("Failed to close embedding backend", e);
            }
        }
    }
}
