package eu.virtualparadox.knowledgebase.ingest.chunker.code;

/**
 * A declaration found by a {@link StructuralParser}.
 *
 * @param kind      node kind, e.g. {@code function}, {@code method}, {@code class}
 * @param name      declared name
 * @param start     first char of the unit, including leading comments and annotations
 * @param end       end of the unit's last line, including its line feed
 * @param bodyStart first char inside the body, where members would be found
 * @param bodyEnd   end of the body, before the closing delimiter
 */
public record CodeUnit(String kind, String name, int start, int end, int bodyStart, int bodyEnd) {

    public boolean isContainer() {
        return switch (kind) {
            case "class", "interface", "enum", "struct", "trait", "impl", "record", "object",
                 "protocol", "extension", "namespace", "module" -> true;
            default -> false;
        };
    }
}
