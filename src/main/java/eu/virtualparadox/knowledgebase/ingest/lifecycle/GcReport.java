package eu.virtualparadox.knowledgebase.ingest.lifecycle;

/**
 * Counts of one garbage collection pass.
 *
 * @param purgedChunks     soft-deleted chunks removed from both stores
 * @param published        committed versions the index had left pending
 * @param discarded        pending versions the catalog never committed
 * @param reindexed        documents whose committed version was missing from the index
 * @param orphansRemoved   documents present in the index but unknown to the catalog
 */
public record GcReport(int purgedChunks, int published, int discarded, int reindexed, int orphansRemoved) {
}
