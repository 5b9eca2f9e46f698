package eu.virtualparadox.knowledgebase.api;

import eu.virtualparadox.knowledgebase.error.ProviderException;
import eu.virtualparadox.knowledgebase.error.StorageException;
import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;
import eu.virtualparadox.knowledgebase.rag.retriever.model.SearchRequest;
import eu.virtualparadox.knowledgebase.rag.retriever.model.SearchResponse;
import eu.virtualparadox.knowledgebase.rag.retriever.model.SearchResult;
import eu.virtualparadox.knowledgebase.rag.retriever.service.RetrieverService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SearchController.class)
class SearchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private RetrieverService retrieverService;

    @Test
    void testSearchPassesFiltersAndReturnsResults() throws Exception {
        final SearchResult result = new SearchResult("doc-1:1:0", "doc-1", 1, 0, "install steps", 0, 13,
                DocumentClass.MARKDOWN, null, "kb", "docs/a.md", Map.of(), 0.03, 0.016, 0.016, null, null, null);
        when(retrieverService.search(any())).thenReturn(new SearchResponse(List.of(result), false, false, 7));

        mockMvc.perform(post("/api/v1/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"query": "install", "topK": 3, "timeoutMillis": 500,
                                 "filters": {"classes": ["markdown"], "knowledgeBases": ["kb"], "pathPrefixes": ["docs/"]}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results[0].chunkId").value("doc-1:1:0"))
                .andExpect(jsonPath("$.results[0].documentClass").value("markdown"))
                .andExpect(jsonPath("$.partial").value(false));

        final ArgumentCaptor<SearchRequest> request = ArgumentCaptor.forClass(SearchRequest.class);
        verify(retrieverService).search(request.capture());
        assertThat(request.getValue().topK()).isEqualTo(3);
        assertThat(request.getValue().timeout()).isEqualTo(Duration.ofMillis(500));
        assertThat(request.getValue().filters().classes()).containsExactly(DocumentClass.MARKDOWN);
        assertThat(request.getValue().filters().pathPrefixes()).containsExactly("docs/");
        assertThat(request.getValue().filters().languages()).isEmpty();
    }

    @Test
    void testBlankQueryIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_error"))
                .andExpect(jsonPath("$.message").value(startsWith("query ")));
    }

    @Test
    void testProviderFailureIsBadGateway() throws Exception {
        when(retrieverService.search(any())).thenThrow(new ProviderException("embedding", "provider unavailable", null));

        mockMvc.perform(post("/api/v1/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"install\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("provider_error"))
                .andExpect(jsonPath("$.stage").value("embedding"));
    }

    @Test
    void testStorageFailureIsServerError() throws Exception {
        when(retrieverService.search(any())).thenThrow(new StorageException("index unreadable", null));

        mockMvc.perform(post("/api/v1/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"install\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("storage_error"))
                .andExpect(jsonPath("$.stage").doesNotExist());
    }
}
