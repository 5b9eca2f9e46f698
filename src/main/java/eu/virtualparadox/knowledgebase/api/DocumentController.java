package eu.virtualparadox.knowledgebase.api;

import eu.virtualparadox.knowledgebase.api.dto.ChunkView;
import eu.virtualparadox.knowledgebase.api.dto.DocumentDetailView;
import eu.virtualparadox.knowledgebase.api.dto.DocumentView;
import eu.virtualparadox.knowledgebase.catalog.entity.DocumentEntity;
import eu.virtualparadox.knowledgebase.catalog.service.DocumentCatalogService;
import eu.virtualparadox.knowledgebase.ingest.lifecycle.DocumentLifecycleManager;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Catalog browsing and removal of documents and knowledge bases.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentCatalogService catalogService;
    private final DocumentLifecycleManager lifecycleManager;

    @GetMapping("/documents")
    public List<DocumentView> documents(@RequestParam(name = "knowledgeBase", required = false) final String knowledgeBase) {
        return catalogService.listDocuments(knowledgeBase).stream().map(DocumentView::of).toList();
    }

    @GetMapping("/documents/{id}")
    public DocumentDetailView document(@PathVariable("id") final String id) {
        final DocumentEntity document = catalogService.getDocument(id);
        return new DocumentDetailView(DocumentView.of(document),
                catalogService.versions(id).stream().map(DocumentDetailView.VersionView::of).toList());
    }

    /**
     * @param includeDeleted also list chunks of superseded versions not yet purged
     */
    @GetMapping("/documents/{id}/chunks")
    public List<ChunkView> chunks(@PathVariable("id") final String id,
                                  @RequestParam(name = "includeDeleted", defaultValue = "false") final boolean includeDeleted) {
        catalogService.getDocument(id);
        return catalogService.chunks(id, includeDeleted).stream().map(ChunkView::of).toList();
    }

    @DeleteMapping("/documents/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") final String id) {
        lifecycleManager.removeDocument(id);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/knowledge-bases/{name}")
    public Map<String, Object> clear(@PathVariable("name") final String name) {
        final int removed = lifecycleManager.clearKnowledgeBase(name);
        return Map.of("knowledgeBase", name, "removed", removed);
    }
}
