package eu.virtualparadox.knowledgebase.rag.index;

import eu.virtualparadox.knowledgebase.rag.index.model.IndexedChunk;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Vector and lexical index of chunks, keyed by chunk id.
 * <p>
 * Entries move through three visibility states:
 * <ul>
 *   <li><b>pending</b>: written by an ingestion attempt, invisible to search</li>
 *   <li><b>live</b>: the committed version of a document, visible to search</li>
 *   <li><b>deleted</b>: superseded or removed, invisible and awaiting purge</li>
 * </ul>
 * {@link #publish(String, int)} makes one version live and retires the previous one in a
 * single commit, so readers observe either the old chunk set or the new one.
 * All mutations throw {@link eu.virtualparadox.knowledgebase.error.StorageException} on I/O failure.
 */
public interface VectorIndexService {

    /**
     * Upserts chunks (by chunk id) in the pending state.
     *
     * @throws IllegalArgumentException if a vector does not match {@link #dimensions()}
     */
    void writePending(List<IndexedChunk> chunks);

    /**
     * Makes {@code version} of the document live and marks every other live version deleted.
     */
    void publish(String documentId, int version);

    /**
     * Removes all entries of one version, whatever their state. Used to roll back a failed attempt.
     */
    void discardVersion(String documentId, int version);

    void deleteDocument(String documentId);

    void deleteChunks(Collection<String> chunkIds);

    /**
     * @return document id to versions that still have pending entries
     */
    Map<String, Set<Integer>> pendingVersions();

    /**
     * @return live version per document
     */
    Map<String, Integer> liveVersions();

    /**
     * Number of entries of one version, in any state.
     */
    int countVersion(String documentId, int version);

    IndexSnapshot openSnapshot();

    int dimensions();
}
