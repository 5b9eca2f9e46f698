package eu.virtualparadox.knowledgebase.api;

import eu.virtualparadox.knowledgebase.api.dto.SearchQuery;
import eu.virtualparadox.knowledgebase.rag.retriever.model.SearchResponse;
import eu.virtualparadox.knowledgebase.rag.retriever.service.RetrieverService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Hybrid search over the committed chunks.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/search")
@RequiredArgsConstructor
public class SearchController {

    private final RetrieverService retrieverService;

    @PostMapping
    public SearchResponse search(@Valid @RequestBody final SearchQuery query) {
        log.debug("Search request: query=\"{}\", topK={}, rerank={}", query.query(), query.topK(), query.rerank());
        return retrieverService.search(query.toRequest());
    }
}
