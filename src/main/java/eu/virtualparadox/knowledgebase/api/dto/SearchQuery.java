package eu.virtualparadox.knowledgebase.api.dto;

import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;
import eu.virtualparadox.knowledgebase.rag.retriever.model.SearchFilters;
import eu.virtualparadox.knowledgebase.rag.retriever.model.SearchRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Body of {@code POST /api/v1/search}.
 */
public record SearchQuery(@NotBlank String query,
                          @Min(1) Integer topK,
                          @Valid Filters filters,
                          Boolean rerank,
                          boolean includeContext,
                          @Positive Long timeoutMillis) {

    public record Filters(Set<DocumentClass> classes,
                          Set<String> languages,
                          Set<String> documentIds,
                          Set<String> knowledgeBases,
                          List<String> pathPrefixes,
                          Instant dateFrom,
                          Instant dateTo) {
    }

    public SearchRequest toRequest() {
        final SearchFilters searchFilters = filters == null
                ? SearchFilters.NONE
                : new SearchFilters(filters.classes(), filters.languages(), filters.documentIds(),
                filters.knowledgeBases(), filters.pathPrefixes(), filters.dateFrom(), filters.dateTo());
        return new SearchRequest(query, topK, searchFilters, rerank, includeContext,
                timeoutMillis == null ? null : Duration.ofMillis(timeoutMillis));
    }
}
