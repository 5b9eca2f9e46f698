package eu.virtualparadox.knowledgebase.rag.retriever.model;

import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Pre-filters applied to both the vector and the lexical search. Empty sets mean
 * "no restriction"; non-empty sets are OR-ed within and AND-ed across fields.
 *
 * @param pathPrefixes origin prefixes; a document matches when its origin starts with any
 * @param dateFrom     inclusive lower bound on the chunk's creation time, or {@code null}
 * @param dateTo       inclusive upper bound on the chunk's creation time, or {@code null}
 */
public record SearchFilters(Set<DocumentClass> classes,
                            Set<String> languages,
                            Set<String> documentIds,
                            Set<String> knowledgeBases,
                            List<String> pathPrefixes,
                            Instant dateFrom,
                            Instant dateTo) {

    public static final SearchFilters NONE = new SearchFilters(null, null, null, null, null, null, null);

    public SearchFilters {
        classes = classes == null ? Set.of() : Set.copyOf(classes);
        languages = languages == null ? Set.of() : Set.copyOf(languages);
        documentIds = documentIds == null ? Set.of() : Set.copyOf(documentIds);
        knowledgeBases = knowledgeBases == null ? Set.of() : Set.copyOf(knowledgeBases);
        pathPrefixes = pathPrefixes == null ? List.of() : List.copyOf(pathPrefixes);
    }

    public static SearchFilters forDocument(final String documentId) {
        return new SearchFilters(null, null, Set.of(documentId), null, null, null, null);
    }
}
