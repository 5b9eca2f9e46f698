package eu.virtualparadox.knowledgebase.rag.embed;

import eu.virtualparadox.knowledgebase.error.ErrorCode;
import eu.virtualparadox.knowledgebase.error.ProviderException;
import eu.virtualparadox.knowledgebase.error.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResilientEmbeddingServiceTest {

    @Mock
    private EmbeddingService backend;

    private ResilientEmbeddingService resilient(final int batchSize) {
        return new ResilientEmbeddingService(backend, batchSize, 2, Duration.ZERO);
    }

    @Test
    void testInputIsSplitIntoBatchesInOrder() {
        final HashingEmbeddingService real = new HashingEmbeddingService(8);
        final ResilientEmbeddingService service = new ResilientEmbeddingService(
                new EmbeddingService() {
                    @Override
                    public float[] embed(final String text) {
                        return real.embed(text);
                    }

                    @Override
                    public List<float[]> embedBatch(final List<String> texts) {
                        assertThat(texts.size()).isLessThanOrEqualTo(2);
                        return real.embedBatch(texts);
                    }

                    @Override
                    public int dimensions() {
                        return 8;
                    }
                }, 2, 1, Duration.ZERO);

        final List<float[]> vectors = service.embedBatch(List.of("a", "b", "c", "d", "e"));

        assertThat(vectors).hasSize(5);
        assertThat(vectors.get(4)).isEqualTo(real.embed("e"));
    }

    @Test
    void testTransientFailureIsRetriedOnce() {
        when(backend.dimensions()).thenReturn(2);
        when(backend.embedBatch(anyList()))
                .thenThrow(new IllegalStateException("rate limited"))
                .thenReturn(List.of(new float[]{1f, 0f}));

        final float[] vector = resilient(4).embed("query");

        assertThat(vector).containsExactly(1f, 0f);
        verify(backend, times(2)).embedBatch(anyList());
    }

    @Test
    void testSecondFailureSurfacesAsProviderError() {
        when(backend.embedBatch(anyList())).thenThrow(new IllegalStateException("timeout"));

        final ProviderException e = assertThrows(ProviderException.class, () -> resilient(4).embed("query"));

        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.PROVIDER);
        assertThat(e.getStage()).isEqualTo("embedding");
        assertThat(e.getMessage()).startsWith("[embedding]");
        verify(backend, times(2)).embedBatch(anyList());
    }

    @Test
    void testWrongDimensionIsRejected() {
        when(backend.dimensions()).thenReturn(3);
        when(backend.embedBatch(anyList())).thenReturn(List.of(new float[]{1f, 0f}));

        assertThrows(ProviderException.class, () -> resilient(4).embed("query"));
    }

    @Test
    void testWrongVectorCountIsRejected() {
        when(backend.embedBatch(anyList())).thenReturn(List.of());

        assertThrows(ProviderException.class, () -> resilient(4).embedBatch(List.of("a")));
    }

    @Test
    void testSameFailureTwiceSurfacesAsProviderError() {
        final IllegalStateException failure = new IllegalStateException("connection reset");
        when(backend.embedBatch(anyList())).thenThrow(failure);

        final ProviderException e = assertThrows(ProviderException.class, () -> resilient(4).embed("query"));

        assertThat(e.getCause()).isSameAs(failure);
        assertThat(failure.getSuppressed()).isEmpty();
    }

    @Test
    void testQueryIsNotBlockedByBusyBatches() throws Exception {
        final HashingEmbeddingService real = new HashingEmbeddingService(8);
        final CountDownLatch batchStarted = new CountDownLatch(1);
        final CountDownLatch releaseBatch = new CountDownLatch(1);
        final ResilientEmbeddingService service = new ResilientEmbeddingService(
                new EmbeddingService() {
                    @Override
                    public float[] embed(final String text) {
                        return real.embed(text);
                    }

                    @Override
                    public List<float[]> embedBatch(final List<String> texts) {
                        if (texts.contains("ingested")) {
                            batchStarted.countDown();
                            try {
                                releaseBatch.await(10, TimeUnit.SECONDS);
                            } catch (final InterruptedException e) {
                                Thread.currentThread().interrupt();
                            }
                        }
                        return real.embedBatch(texts);
                    }

                    @Override
                    public int dimensions() {
                        return 8;
                    }
                }, 4, 1, Duration.ZERO);

        final CompletableFuture<List<float[]>> ingestion =
                CompletableFuture.supplyAsync(() -> service.embedBatch(List.of("ingested")));
        assertThat(batchStarted.await(5, TimeUnit.SECONDS)).isTrue();

        final float[] vector = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> service.embed("query"));

        assertThat(vector).isEqualTo(real.embed("query"));
        releaseBatch.countDown();
        assertThat(ingestion.get(5, TimeUnit.SECONDS)).hasSize(1);
    }

    @Test
    void testBlankQueryIsRejected() {
        assertThrows(ValidationException.class, () -> resilient(4).embed("  "));
    }
}
