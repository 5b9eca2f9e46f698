package eu.virtualparadox.knowledgebase.api;

import eu.virtualparadox.knowledgebase.catalog.entity.ChunkEntity;
import eu.virtualparadox.knowledgebase.catalog.entity.DocumentEntity;
import eu.virtualparadox.knowledgebase.catalog.entity.DocumentVersionEntity;
import eu.virtualparadox.knowledgebase.catalog.service.DocumentCatalogService;
import eu.virtualparadox.knowledgebase.error.ConflictException;
import eu.virtualparadox.knowledgebase.error.NotFoundException;
import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;
import eu.virtualparadox.knowledgebase.ingest.lifecycle.DocumentLifecycleManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DocumentController.class)
class DocumentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private DocumentCatalogService catalogService;

    @MockitoBean
    private DocumentLifecycleManager lifecycleManager;

    @Test
    void testDocumentWithVersions() throws Exception {
        when(catalogService.getDocument("doc-1")).thenReturn(document());
        when(catalogService.versions("doc-1")).thenReturn(List.of(
                DocumentVersionEntity.builder().documentId("doc-1").version(1).contentHash("h1")
                        .documentClass(DocumentClass.CODE).chunkCount(4).build(),
                DocumentVersionEntity.builder().documentId("doc-1").version(2).contentHash("h2")
                        .documentClass(DocumentClass.CODE).chunkCount(5).build()));

        mockMvc.perform(get("/api/v1/documents/doc-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.document.currentVersion").value(2))
                .andExpect(jsonPath("$.document.documentClass").value("code"))
                .andExpect(jsonPath("$.versions.length()").value(2))
                .andExpect(jsonPath("$.versions[1].chunkCount").value(5));
    }

    @Test
    void testChunksOfUnknownDocumentAreNotFound() throws Exception {
        when(catalogService.getDocument("missing")).thenThrow(new NotFoundException("document", "missing"));

        mockMvc.perform(get("/api/v1/documents/missing/chunks"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("not_found"));
    }

    @Test
    void testChunksIncludeDeletedOnRequest() throws Exception {
        when(catalogService.getDocument("doc-1")).thenReturn(document());
        when(catalogService.chunks("doc-1", true)).thenReturn(List.of(
                ChunkEntity.builder().id("doc-1:1:0").documentId("doc-1").version(1).ordinal(0)
                        .text("old").deleted(true).metadata(Map.of()).build()));

        mockMvc.perform(get("/api/v1/documents/doc-1/chunks").param("includeDeleted", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("doc-1:1:0"))
                .andExpect(jsonPath("$[0].deleted").value(true));
    }

    @Test
    void testDeleteAnswersNoContent() throws Exception {
        mockMvc.perform(delete("/api/v1/documents/doc-1"))
                .andExpect(status().isNoContent());

        verify(lifecycleManager).removeDocument("doc-1");
    }

    @Test
    void testDeleteOfBusyDocumentConflicts() throws Exception {
        doThrow(new ConflictException("document doc-1 is being ingested")).when(lifecycleManager).removeDocument("doc-1");

        mockMvc.perform(delete("/api/v1/documents/doc-1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("conflict"));
    }

    @Test
    void testClearKnowledgeBaseReportsCount() throws Exception {
        when(lifecycleManager.clearKnowledgeBase("kb")).thenReturn(3);

        mockMvc.perform(delete("/api/v1/knowledge-bases/kb"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.knowledgeBase").value("kb"))
                .andExpect(jsonPath("$.removed").value(3));
    }

    private static DocumentEntity document() {
        return DocumentEntity.builder()
                .id("doc-1")
                .knowledgeBase("kb")
                .origin("src/App.java")
                .contentHash("h2")
                .documentClass(DocumentClass.CODE)
                .currentVersion(2)
                .build();
    }
}
