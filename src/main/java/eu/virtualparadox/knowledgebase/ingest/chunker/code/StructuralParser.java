package eu.virtualparadox.knowledgebase.ingest.chunker.code;

import java.util.List;

/**
 * Finds declarations in source code.
 */
public interface StructuralParser {

    /**
     * Declarations directly inside {@code [start, end)}, ordered and non-overlapping.
     *
     * @param container enclosing declaration, {@code null} at file level
     * @throws CodeParseException when the code is malformed
     */
    List<CodeUnit> parse(String source, int start, int end, CodeUnit container);
}
