package eu.virtualparadox.knowledgebase.ingest.chunker;

import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;
import eu.virtualparadox.knowledgebase.ingest.model.ChunkDraft;
import eu.virtualparadox.knowledgebase.ingest.model.ChunkMetadata;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Row-based chunking of delimited or pipe tables. Rows are never split; each chunk after
 * the first repeats the last {@code overlap} rows of its predecessor. The header row (plus a
 * markdown separator row, if any) stays in the first chunk and is copied into the metadata
 * of every chunk so rows remain interpretable.
 */
@Component
public class TableChunkingStrategy implements ChunkingStrategy {

    public static final String NAME = "table-rows";

    private static final Pattern SEPARATOR_ROW = Pattern.compile("^\\s*\\|?\\s*:?-{3,}.*");
    private static final char[] DELIMITERS = {'\t', '|', ',', ';'};

    @Override
    public DocumentClass documentClass() {
        return DocumentClass.TABLE;
    }

    @Override
    public String strategyName() {
        return NAME;
    }

    @Override
    public List<ChunkDraft> chunk(final TextRegion region, final ChunkingProfile profile) {
        if (region.isBlank()) {
            return List.of();
        }
        final String source = region.source();
        final List<Unit> lines = Drafts.lines(source, region.start(), region.end());

        // blank lead-in and the header (with a separator row) form one unit
        int headerIdx = 0;
        while (headerIdx < lines.size() && lines.get(headerIdx).tokens() == 0) {
            headerIdx++;
        }
        int headerEnd = headerIdx + 1;
        if (headerEnd < lines.size() && SEPARATOR_ROW.matcher(text(source, lines.get(headerEnd))).matches()) {
            headerEnd++;
        }
        final String header = text(source, lines.get(headerIdx)).strip();

        final List<Unit> rows = new ArrayList<>();
        int headTokens = 0;
        for (int i = 0; i < headerEnd; i++) {
            headTokens += lines.get(i).tokens();
        }
        rows.add(new Unit(lines.get(0).start(), lines.get(headerEnd - 1).end(), headTokens, headerEnd - headerIdx));
        for (int i = headerEnd; i < lines.size(); i++) {
            final Unit line = lines.get(i);
            if (line.tokens() == 0 && !rows.isEmpty()) {
                // blank lines ride with the previous row
                final Unit prev = rows.remove(rows.size() - 1);
                rows.add(new Unit(prev.start(), line.end(), prev.tokens(), prev.lines()));
            } else {
                rows.add(line);
            }
        }

        final List<int[]> groups = UnitPacker.pack(rows, profile.minTokens(), profile.maxTokens(),
                UnitPacker.overlapLines(profile.overlap()));

        final LineIndex index = new LineIndex(source);
        final List<ChunkDraft> drafts = new ArrayList<>(groups.size());
        for (final int[] group : groups) {
            final int start = UnitPacker.start(rows, group);
            final int end = UnitPacker.end(rows, group);
            final Map<String, Object> meta = Drafts.meta(NAME);
            meta.put(ChunkMetadata.TABLE_HEADER, header);
            meta.put(ChunkMetadata.DELIMITER, String.valueOf(delimiter(header)));
            meta.put(ChunkMetadata.START_LINE, index.lineOf(start));
            meta.put(ChunkMetadata.END_LINE, index.lineOf(Math.max(start, end - 1)));
            drafts.add(Drafts.of(source, start, end, meta));
        }
        return drafts;
    }

    static char delimiter(final String header) {
        char best = ',';
        int bestCount = 0;
        for (final char d : DELIMITERS) {
            int count = 0;
            for (int i = 0; i < header.length(); i++) {
                if (header.charAt(i) == d) {
                    count++;
                }
            }
            if (count > bestCount) {
                best = d;
                bestCount = count;
            }
        }
        return best;
    }

    private static String text(final String source, final Unit unit) {
        return source.substring(unit.start(), unit.end());
    }
}
