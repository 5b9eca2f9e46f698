package eu.virtualparadox.knowledgebase.ingest.chunker;

/**
 * Atomic piece a strategy packs into chunks: a sentence, a row, a block, a log entry.
 * Units of one region are contiguous, so packing them never leaves gaps.
 */
record Unit(int start, int end, int tokens, int lines) {

    Unit(final int start, final int end, final int tokens) {
        this(start, end, tokens, 1);
    }
}
