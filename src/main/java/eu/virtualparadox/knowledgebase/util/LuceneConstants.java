package eu.virtualparadox.knowledgebase.util;

/**
 * Field names of the chunk index. Every chunk is one Lucene document carrying its vector,
 * its BM25-indexed text and the denormalized filter fields.
 */
public final class LuceneConstants {

    public static final String FIELD_VECTOR = "vector";
    public static final String FIELD_TEXT = "text";

    public static final String FIELD_CHUNK_ID = "chunkId";
    public static final String FIELD_DOC_ID = "docId";
    public static final String FIELD_VERSION = "version";
    /** {@code docId#version}, the unit of the visibility switch. */
    public static final String FIELD_VERSION_KEY = "versionKey";
    public static final String FIELD_CLASS = "documentClass";
    public static final String FIELD_LANGUAGE = "language";
    public static final String FIELD_KNOWLEDGE_BASE = "knowledgeBase";
    public static final String FIELD_ORIGIN = "origin";
    public static final String FIELD_CREATED_AT = "createdAt";
    public static final String FIELD_START = "startOffset";
    public static final String FIELD_END = "endOffset";
    public static final String FIELD_ORDINAL = "ordinal";
    public static final String FIELD_METADATA = "metadata";

    /** Numeric doc-values field holding one of the {@code LIFECYCLE_*} states. */
    public static final String FIELD_LIFECYCLE = "lifecycle";

    public static final long LIFECYCLE_PENDING = 0L;
    public static final long LIFECYCLE_LIVE = 1L;
    public static final long LIFECYCLE_DELETED = 2L;

    /** Commit user-data key recording the vector dimension the index was built with. */
    public static final String COMMIT_DIMENSIONS = "embedding.dimensions";

    public static String versionKey(final String docId, final int version) {
        return docId + "#" + version;
    }

    private LuceneConstants() {
        // prevent instantiation
    }
}
