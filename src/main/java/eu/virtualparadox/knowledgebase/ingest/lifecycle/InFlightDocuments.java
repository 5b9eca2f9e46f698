package eu.virtualparadox.knowledgebase.ingest.lifecycle;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Documents currently owned by an ingestion job, a removal or a garbage collection pass.
 * At most one owner per document id at a time.
 */
@Component
public class InFlightDocuments {

    private final Set<String> claimed = ConcurrentHashMap.newKeySet();

    /**
     * @return {@code false} if another owner holds the document
     */
    public boolean tryClaim(final String documentId) {
        return claimed.add(documentId);
    }

    public void release(final String documentId) {
        claimed.remove(documentId);
    }

    public boolean isClaimed(final String documentId) {
        return claimed.contains(documentId);
    }
}
