package eu.virtualparadox.knowledgebase.ingest.model;

/**
 * Keys used in chunk metadata maps.
 */
public final class ChunkMetadata {

    public static final String STRATEGY = "strategy";
    public static final String LANGUAGE = "language";
    public static final String NODE_KIND = "nodeKind";
    public static final String SYMBOL = "symbol";
    public static final String PRIMARY = "primary";
    public static final String START_LINE = "startLine";
    public static final String END_LINE = "endLine";
    public static final String HEADER_PATH = "headerPath";
    public static final String HEADER_LEVEL = "headerLevel";
    public static final String TABLE_HEADER = "header";
    public static final String DELIMITER = "delimiter";
    public static final String ROW_START = "rowStart";
    public static final String ROW_END = "rowEnd";
    public static final String CONFIG_FORMAT = "format";
    public static final String CONFIG_KEYS = "keys";
    public static final String FIRST_TIMESTAMP = "firstTimestamp";
    public static final String LAST_TIMESTAMP = "lastTimestamp";
    public static final String REGION_CLASS = "regionClass";
    public static final String FALLBACK_REASON = "fallbackReason";

    private ChunkMetadata() {
        // prevent instantiation
    }
}
