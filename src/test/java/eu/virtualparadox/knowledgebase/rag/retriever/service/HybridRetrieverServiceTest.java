package eu.virtualparadox.knowledgebase.rag.retriever.service;

import eu.virtualparadox.knowledgebase.application.config.KnowledgeProperties;
import eu.virtualparadox.knowledgebase.application.executor.QueryExecutor;
import eu.virtualparadox.knowledgebase.catalog.entity.ChunkEntity;
import eu.virtualparadox.knowledgebase.catalog.service.DocumentCatalogService;
import eu.virtualparadox.knowledgebase.error.ProviderException;
import eu.virtualparadox.knowledgebase.error.StorageException;
import eu.virtualparadox.knowledgebase.error.ValidationException;
import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;
import eu.virtualparadox.knowledgebase.rag.embed.EmbeddingService;
import eu.virtualparadox.knowledgebase.rag.index.IndexSnapshot;
import eu.virtualparadox.knowledgebase.rag.index.VectorIndexService;
import eu.virtualparadox.knowledgebase.rag.index.model.IndexHit;
import eu.virtualparadox.knowledgebase.rag.rerank.model.RerankResult;
import eu.virtualparadox.knowledgebase.rag.rerank.service.RerankService;
import eu.virtualparadox.knowledgebase.rag.retriever.model.SearchFilters;
import eu.virtualparadox.knowledgebase.rag.retriever.model.SearchRequest;
import eu.virtualparadox.knowledgebase.rag.retriever.model.SearchResponse;
import eu.virtualparadox.knowledgebase.rag.retriever.model.SearchResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class HybridRetrieverServiceTest {

    private static final float[] QUERY_VECTOR = {1f, 0f};

    @Mock
    private EmbeddingService embeddingService;
    @Mock
    private VectorIndexService vectorIndexService;
    @Mock
    private IndexSnapshot snapshot;
    @Mock
    private DocumentCatalogService catalogService;
    @Mock
    private ObjectProvider<RerankService> rerankProvider;
    @Mock
    private RerankService reranker;

    private QueryExecutor queryExecutor;
    private KnowledgeProperties properties;
    private HybridRetrieverService retriever;

    @BeforeEach
    void setUp() {
        queryExecutor = new QueryExecutor();
        queryExecutor.setCorePoolSize(2);
        queryExecutor.setThreadNamePrefix("query-test-");
        queryExecutor.initialize();

        properties = new KnowledgeProperties();
        properties.getRerank().setEnabledByDefault(false);

        when(embeddingService.embed(anyString())).thenReturn(QUERY_VECTOR);
        when(vectorIndexService.openSnapshot()).thenReturn(snapshot);

        retriever = new HybridRetrieverService(embeddingService, vectorIndexService, catalogService,
                rerankProvider, queryExecutor, properties);
    }

    @AfterEach
    void tearDown() {
        queryExecutor.shutdown();
    }

    @Test
    void testBothListsAreFused() {
        when(snapshot.knnSearch(eq(QUERY_VECTOR), anyInt(), any())).thenReturn(List.of(hit("a"), hit("b")));
        when(snapshot.lexicalSearch(eq("needle"), anyInt(), any())).thenReturn(List.of(hit("b"), hit("c")));

        final SearchResponse response = retriever.search(SearchRequest.of("needle", 3));

        assertThat(response.results()).extracting(SearchResult::chunkId).containsExactly("b", "a", "c");
        final SearchResult top = response.results().get(0);
        assertThat(top.vectorScore()).isEqualTo(1.0 / 62);
        assertThat(top.lexicalScore()).isEqualTo(1.0 / 61);
        assertThat(top.score()).isEqualTo(1.0 / 62 + 1.0 / 61);
        assertThat(response.results().get(2).vectorScore()).isZero();
        assertThat(response.partial()).isFalse();
        assertThat(response.reranked()).isFalse();
        verify(snapshot, timeout(1000)).close();
    }

    @Test
    void testCandidatePoolIsTopKTimesMultiplier() {
        when(snapshot.knnSearch(any(), anyInt(), any())).thenReturn(List.of());
        when(snapshot.lexicalSearch(anyString(), anyInt(), any())).thenReturn(List.of());

        final SearchResponse response = retriever.search(SearchRequest.of("q", 4));

        assertThat(response.results()).isEmpty();
        verify(snapshot).knnSearch(any(), eq(12), eq(SearchFilters.NONE));
        verify(snapshot).lexicalSearch(eq("q"), eq(12), eq(SearchFilters.NONE));
    }

    @Test
    void testDefaultAndCappedTopK() {
        when(snapshot.knnSearch(any(), anyInt(), any())).thenReturn(List.of());
        when(snapshot.lexicalSearch(anyString(), anyInt(), any())).thenReturn(List.of());

        retriever.search(new SearchRequest("q", null, null, null, false, null));
        verify(snapshot).knnSearch(any(), eq(15), any());

        retriever.search(new SearchRequest("q", 5000, null, null, false, null));
        verify(snapshot).knnSearch(any(), eq(300), any());
    }

    @Test
    void testInvalidRequestsAreRejected() {
        assertThatThrownBy(() -> retriever.search(SearchRequest.of("  ", 3))).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> retriever.search(SearchRequest.of("q", 0))).isInstanceOf(ValidationException.class);
        verify(embeddingService, never()).embed(anyString());
    }

    @Test
    void testRerankerReordersCandidates() {
        when(snapshot.knnSearch(any(), anyInt(), any())).thenReturn(List.of(hit("a"), hit("b"), hit("c")));
        when(snapshot.lexicalSearch(anyString(), anyInt(), any())).thenReturn(List.of());
        when(rerankProvider.getIfAvailable()).thenReturn(reranker);
        when(reranker.rerank(eq("q"), anyList())).thenAnswer(invocation -> {
            final List<SearchResult> candidates = invocation.getArgument(1);
            final List<RerankResult> scored = new ArrayList<>();
            for (int i = candidates.size() - 1; i >= 0; i--) {
                scored.add(new RerankResult(candidates.get(i), i + 1f));
            }
            return scored;
        });

        final SearchResponse response = retriever.search(new SearchRequest("q", 2, null, true, false, null));

        assertThat(response.reranked()).isTrue();
        assertThat(response.results()).extracting(SearchResult::chunkId).containsExactly("c", "b");
        assertThat(response.results().get(0).rerankScore()).isEqualTo(3f);
        assertThat(response.results().get(0).score()).isEqualTo(3.0);
    }

    @Test
    void testRerankerFailureKeepsFusedOrder() {
        when(snapshot.knnSearch(any(), anyInt(), any())).thenReturn(List.of(hit("a"), hit("b"), hit("c"), hit("d")));
        when(snapshot.lexicalSearch(anyString(), anyInt(), any())).thenReturn(List.of());
        when(rerankProvider.getIfAvailable()).thenReturn(reranker);
        when(reranker.rerank(anyString(), anyList())).thenThrow(new IllegalStateException("model crashed"));

        final SearchResponse response = retriever.search(new SearchRequest("q", 2, null, true, false, null));

        assertThat(response.reranked()).isFalse();
        assertThat(response.results()).extracting(SearchResult::chunkId).containsExactly("a", "b");
        assertThat(response.results()).allSatisfy(r -> assertThat(r.rerankScore()).isNull());
    }

    @Test
    void testRerankIsSkippedWhenNotRequested() {
        when(snapshot.knnSearch(any(), anyInt(), any())).thenReturn(List.of(hit("a")));
        when(snapshot.lexicalSearch(anyString(), anyInt(), any())).thenReturn(List.of());
        when(rerankProvider.getIfAvailable()).thenReturn(reranker);

        final SearchResponse response = retriever.search(SearchRequest.of("q", 2));

        assertThat(response.reranked()).isFalse();
        verify(reranker, never()).rerank(anyString(), anyList());
    }

    @Test
    void testSlowLegYieldsPartialResults() {
        when(snapshot.knnSearch(any(), anyInt(), any())).thenAnswer(invocation -> {
            Thread.sleep(1500);
            return List.of(hit("late"));
        });
        when(snapshot.lexicalSearch(anyString(), anyInt(), any())).thenReturn(List.of(hit("fast")));

        final SearchResponse response = retriever.search(
                new SearchRequest("q", 3, null, false, false, Duration.ofMillis(200)));

        assertThat(response.partial()).isTrue();
        assertThat(response.results()).extracting(SearchResult::chunkId).containsExactly("fast");
        verify(snapshot, timeout(3000)).close();
    }

    @Test
    void testSlowEmbedderFallsBackToLexicalResults() {
        when(embeddingService.embed(anyString())).thenAnswer(invocation -> {
            Thread.sleep(2000);
            return QUERY_VECTOR;
        });
        when(snapshot.knnSearch(any(), anyInt(), any())).thenReturn(List.of(hit("semantic")));
        when(snapshot.lexicalSearch(anyString(), anyInt(), any())).thenReturn(List.of(hit("keyword")));

        final long started = System.nanoTime();
        final SearchResponse response = retriever.search(
                new SearchRequest("q", 3, null, false, false, Duration.ofMillis(200)));
        final long tookMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertThat(tookMillis).isLessThan(1500);
        assertThat(response.partial()).isTrue();
        assertThat(response.results()).extracting(SearchResult::chunkId).containsExactly("keyword");
        assertThat(response.results().get(0).vectorScore()).isZero();
    }

    @Test
    void testEmbeddingFailurePropagatesProviderError() {
        when(embeddingService.embed(anyString())).thenThrow(new ProviderException("embedding", "model down", null));
        when(snapshot.lexicalSearch(anyString(), anyInt(), any())).thenReturn(List.of());

        assertThatThrownBy(() -> retriever.search(SearchRequest.of("q", 3)))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("model down");
        verify(snapshot, never()).knnSearch(any(), anyInt(), any());
        verify(snapshot, timeout(1000)).close();
    }

    @Test
    void testFailingLegPropagatesStorageError() {
        when(snapshot.knnSearch(any(), anyInt(), any()))
                .thenThrow(new StorageException("indexing", "vector search failed", null));
        when(snapshot.lexicalSearch(anyString(), anyInt(), any())).thenReturn(List.of());

        assertThatThrownBy(() -> retriever.search(SearchRequest.of("q", 3))).isInstanceOf(StorageException.class);
    }

    @Test
    void testContextIsAttachedAndBestEffort() {
        when(snapshot.knnSearch(any(), anyInt(), any())).thenReturn(List.of(hit("a"), hit("b")));
        when(snapshot.lexicalSearch(anyString(), anyInt(), any())).thenReturn(List.of());
        final ChunkEntity neighbour = ChunkEntity.builder()
                .id("doc-a:1:0").documentId("doc-a").version(1).ordinal(0)
                .text("before").startOffset(0).endOffset(6).build();
        when(catalogService.previousChunk(eq("doc-a"), eq(1), anyInt())).thenReturn(Optional.of(neighbour));
        when(catalogService.nextChunk(eq("doc-a"), eq(1), anyInt())).thenReturn(Optional.empty());
        when(catalogService.previousChunk(eq("doc-b"), eq(1), anyInt()))
                .thenThrow(new StorageException("catalog", "database down", null));

        final SearchResponse response = retriever.search(new SearchRequest("q", 2, null, false, true, null));

        final SearchResult first = response.results().get(0);
        assertThat(first.previous()).isNotNull();
        assertThat(first.previous().text()).isEqualTo("before");
        assertThat(first.next()).isNull();
        assertThat(response.results().get(1).previous()).isNull();
    }

    private static IndexHit hit(final String id) {
        return new IndexHit(id, "doc-" + id, 1, 1, "text of " + id, 10, 20, DocumentClass.TEXT, "en",
                "default", "origin/" + id, Map.of(), 0.5f);
    }
}
