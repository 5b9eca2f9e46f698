package eu.virtualparadox.knowledgebase.rag.retriever.service;

import eu.virtualparadox.knowledgebase.application.config.KnowledgeProperties;
import eu.virtualparadox.knowledgebase.application.executor.QueryExecutor;
import eu.virtualparadox.knowledgebase.catalog.entity.ChunkEntity;
import eu.virtualparadox.knowledgebase.catalog.service.DocumentCatalogService;
import eu.virtualparadox.knowledgebase.error.KnowledgeBaseException;
import eu.virtualparadox.knowledgebase.error.StorageException;
import eu.virtualparadox.knowledgebase.error.ValidationException;
import eu.virtualparadox.knowledgebase.rag.embed.EmbeddingService;
import eu.virtualparadox.knowledgebase.rag.index.IndexSnapshot;
import eu.virtualparadox.knowledgebase.rag.index.VectorIndexService;
import eu.virtualparadox.knowledgebase.rag.index.model.IndexHit;
import eu.virtualparadox.knowledgebase.rag.rerank.model.RerankResult;
import eu.virtualparadox.knowledgebase.rag.rerank.service.RerankService;
import eu.virtualparadox.knowledgebase.rag.retriever.model.ContextChunk;
import eu.virtualparadox.knowledgebase.rag.retriever.model.FusedCandidate;
import eu.virtualparadox.knowledgebase.rag.retriever.model.SearchRequest;
import eu.virtualparadox.knowledgebase.rag.retriever.model.SearchResponse;
import eu.virtualparadox.knowledgebase.rag.retriever.model.SearchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Hybrid retriever: combines ANN semantic search (vector) with lexical BM25 keyword search.
 * <p>
 * Steps:
 * <ol>
 *   <li>Run two legs side by side on one index snapshot, both pre-filtered and each returning
 *       {@code topK * candidateMultiplier} candidates: embed the query then KNN, and BM25</li>
 *   <li>Fuse both rankings with {@link ReciprocalRankFusion}</li>
 *   <li>Optionally rerank the top {@code topK * rerankFanOut}; on reranker failure keep the fused order</li>
 *   <li>Truncate to {@code topK} and attach neighbouring chunks when asked</li>
 * </ol>
 * When the deadline passes before both legs finish, the lists that did finish are fused
 * and the response is flagged partial. A slow embedder therefore degrades to lexical-only results.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HybridRetrieverService implements RetrieverService {

    private static final String STAGE = "search";

    private final EmbeddingService embeddingService;
    private final VectorIndexService vectorIndexService;
    private final DocumentCatalogService catalogService;
    private final ObjectProvider<RerankService> rerankService;
    private final QueryExecutor queryExecutor;
    private final KnowledgeProperties properties;

    /**
     * Outcome of one search list: its hits, or {@code timedOut} when the deadline passed first.
     */
    private record Leg(List<IndexHit> hits, boolean timedOut) {
    }

    @Override
    public SearchResponse search(final SearchRequest request) {
        final long started = System.nanoTime();
        final KnowledgeProperties.Retrieval settings = properties.getRetrieval();
        final String query = validateQuery(request);
        final int topK = resolveTopK(request.topK(), settings);
        final Optional<RerankService> reranker = rerankerFor(request);
        final int pool = topK * Math.max(1, settings.getCandidateMultiplier());
        final Duration timeout = request.timeout() != null ? request.timeout() : settings.getQueryTimeout();
        final long deadline = started + timeout.toNanos();

        final IndexSnapshot snapshot = vectorIndexService.openSnapshot();
        final CompletableFuture<List<IndexHit>> vectorLeg;
        final CompletableFuture<List<IndexHit>> lexicalLeg;
        try {
            vectorLeg = CompletableFuture.supplyAsync(
                    () -> snapshot.knnSearch(embeddingService.embed(query), pool, request.filters()), queryExecutor);
            lexicalLeg = CompletableFuture.supplyAsync(
                    () -> snapshot.lexicalSearch(query, pool, request.filters()), queryExecutor);
        } catch (final RuntimeException e) {
            snapshot.close();
            throw new StorageException(STAGE, "could not schedule search", e);
        }
        // the snapshot outlives the call when a leg overruns the deadline
        CompletableFuture.allOf(vectorLeg, lexicalLeg).whenComplete((ignored, error) -> snapshot.close());

        final Leg vectorHits = await(vectorLeg, deadline, "vector");
        final Leg lexicalHits = await(lexicalLeg, deadline, "lexical");
        final boolean partial = vectorHits.timedOut() || lexicalHits.timedOut();
        if (partial) {
            log.warn("Search deadline of {} ms passed, returning partial results (vector done: {}, lexical done: {})",
                    timeout.toMillis(), !vectorHits.timedOut(), !lexicalHits.timedOut());
        }

        final List<FusedCandidate> fused = ReciprocalRankFusion.fuse(
                ids(vectorHits.hits()), ids(lexicalHits.hits()), settings.getRrfK());
        log.debug("Query '{}': {} vector hits, {} lexical hits, {} fused candidates",
                query, vectorHits.hits().size(), lexicalHits.hits().size(), fused.size());

        final Map<String, IndexHit> byId = new HashMap<>();
        vectorHits.hits().forEach(hit -> byId.putIfAbsent(hit.chunkId(), hit));
        lexicalHits.hits().forEach(hit -> byId.putIfAbsent(hit.chunkId(), hit));

        final int limit = reranker.isPresent() ? topK * Math.max(1, settings.getRerankFanOut()) : topK;
        final List<SearchResult> candidates = new ArrayList<>(Math.min(limit, fused.size()));
        for (final FusedCandidate candidate : fused) {
            if (candidates.size() == limit) {
                break;
            }
            candidates.add(toResult(byId.get(candidate.chunkId()), candidate));
        }

        List<SearchResult> results = truncate(candidates, topK);
        boolean reranked = false;
        if (reranker.isPresent() && !candidates.isEmpty()) {
            try {
                results = rerank(reranker.get(), query, candidates, topK);
                reranked = true;
            } catch (final RuntimeException e) {
                log.warn("Reranking failed, keeping fused order: {}", e.getMessage());
            }
        }

        if (request.includeContext()) {
            results = withContext(results);
        }

        final long tookMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        return new SearchResponse(results, partial, reranked, tookMillis);
    }

    private static String validateQuery(final SearchRequest request) {
        if (request == null || request.query() == null || request.query().isBlank()) {
            throw new ValidationException("query must not be blank");
        }
        return request.query().strip();
    }

    private static int resolveTopK(final Integer requested, final KnowledgeProperties.Retrieval settings) {
        if (requested == null) {
            return settings.getDefaultTopK();
        }
        if (requested < 1) {
            throw new ValidationException("topK must be at least 1");
        }
        return Math.min(requested, settings.getMaxTopK());
    }

    private Optional<RerankService> rerankerFor(final SearchRequest request) {
        final boolean wanted = request.rerank() != null
                ? request.rerank()
                : properties.getRerank().isEnabledByDefault();
        return wanted ? Optional.ofNullable(rerankService.getIfAvailable()) : Optional.empty();
    }

    private static Leg await(final CompletableFuture<List<IndexHit>> leg, final long deadline, final String name) {
        final long remaining = Math.max(0L, deadline - System.nanoTime());
        try {
            return new Leg(leg.get(remaining, TimeUnit.NANOSECONDS), false);
        } catch (final TimeoutException e) {
            return new Leg(List.of(), true);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Leg(List.of(), true);
        } catch (final ExecutionException e) {
            if (e.getCause() instanceof KnowledgeBaseException kbe) {
                throw kbe;
            }
            throw new StorageException(STAGE, name + " search failed", e.getCause());
        }
    }

    private static List<SearchResult> rerank(final RerankService reranker,
                                             final String query,
                                             final List<SearchResult> candidates,
                                             final int topK) {
        final List<RerankResult> scored = reranker.rerank(query, candidates);
        if (scored.size() != candidates.size()) {
            throw new IllegalStateException("reranker returned " + scored.size() + " scores for "
                    + candidates.size() + " candidates");
        }
        final List<SearchResult> results = new ArrayList<>(Math.min(topK, scored.size()));
        for (final RerankResult r : scored) {
            if (results.size() == topK) {
                break;
            }
            results.add(r.result().withRerankScore(r.score()));
        }
        return results;
    }

    /**
     * Attaches the neighbouring chunks of every result; lookup failures leave them empty.
     */
    private List<SearchResult> withContext(final List<SearchResult> results) {
        final List<SearchResult> expanded = new ArrayList<>(results.size());
        for (final SearchResult result : results) {
            try {
                final ContextChunk before = catalogService
                        .previousChunk(result.documentId(), result.version(), result.startOffset())
                        .map(HybridRetrieverService::toContext).orElse(null);
                final ContextChunk after = catalogService
                        .nextChunk(result.documentId(), result.version(), result.startOffset())
                        .map(HybridRetrieverService::toContext).orElse(null);
                expanded.add(result.withContext(before, after));
            } catch (final KnowledgeBaseException e) {
                log.warn("Could not load context of chunk {}: {}", result.chunkId(), e.getMessage());
                expanded.add(result);
            }
        }
        return expanded;
    }

    private static ContextChunk toContext(final ChunkEntity chunk) {
        return new ContextChunk(chunk.getId(), chunk.getOrdinal(), chunk.getText(),
                chunk.getStartOffset(), chunk.getEndOffset());
    }

    private static SearchResult toResult(final IndexHit hit, final FusedCandidate fused) {
        return new SearchResult(hit.chunkId(), hit.documentId(), hit.version(), hit.ordinal(), hit.text(),
                hit.startOffset(), hit.endOffset(), hit.documentClass(), hit.language(), hit.knowledgeBase(),
                hit.origin(), hit.metadata(), fused.score(), fused.vectorScore(), fused.lexicalScore(),
                null, null, null);
    }

    private static List<String> ids(final List<IndexHit> hits) {
        final List<String> ids = new ArrayList<>(hits.size());
        for (final IndexHit hit : hits) {
            ids.add(hit.chunkId());
        }
        return ids;
    }

    private static List<SearchResult> truncate(final List<SearchResult> results, final int topK) {
        return results.size() <= topK ? results : new ArrayList<>(results.subList(0, topK));
    }
}
