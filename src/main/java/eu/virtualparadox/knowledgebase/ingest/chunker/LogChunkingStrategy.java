package eu.virtualparadox.knowledgebase.ingest.chunker;

import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;
import eu.virtualparadox.knowledgebase.ingest.model.ChunkDraft;
import eu.virtualparadox.knowledgebase.ingest.model.ChunkMetadata;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented log chunking. Lines are grouped into entries (a timestamped or levelled line
 * plus its continuation lines, e.g. a stack trace), entries are packed up to {@code maxTokens}
 * and consecutive chunks share their last {@code overlap} lines.
 */
@Component
public class LogChunkingStrategy implements ChunkingStrategy {

    public static final String NAME = "log-lines";

    static final Pattern TIMESTAMP = Pattern.compile(
            "\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}:\\d{2}(?:[.,]\\d+)?(?:Z|[+-]\\d{2}:?\\d{2})?"
                    + "|\\b[A-Z][a-z]{2}\\s+\\d{1,2}\\s+\\d{2}:\\d{2}:\\d{2}");
    private static final Pattern ENTRY_START = Pattern.compile(
            "^\\[?(?:\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}|[A-Z][a-z]{2}\\s+\\d{1,2}\\s+\\d{2}:\\d{2}|\\d{2}:\\d{2}:\\d{2})"
                    + "|^\\[?(?:TRACE|DEBUG|INFO|WARN|WARNING|ERROR|FATAL)\\b");

    @Override
    public DocumentClass documentClass() {
        return DocumentClass.LOG;
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
        final List<Unit> entries = entries(source, region.start(), region.end(), profile.maxTokens());
        final List<int[]> groups = UnitPacker.pack(entries, profile.minTokens(), profile.maxTokens(),
                UnitPacker.overlapLines(profile.overlap()));

        final LineIndex index = new LineIndex(source);
        final List<ChunkDraft> drafts = new ArrayList<>(groups.size());
        for (final int[] group : groups) {
            final int start = UnitPacker.start(entries, group);
            final int end = UnitPacker.end(entries, group);
            final Map<String, Object> meta = Drafts.meta(NAME);
            meta.put(ChunkMetadata.START_LINE, index.lineOf(start));
            meta.put(ChunkMetadata.END_LINE, index.lineOf(Math.max(start, end - 1)));
            final List<String> stamps = timestamps(source.substring(start, end));
            if (!stamps.isEmpty()) {
                meta.put(ChunkMetadata.FIRST_TIMESTAMP, stamps.get(0));
                meta.put(ChunkMetadata.LAST_TIMESTAMP, stamps.get(stamps.size() - 1));
            }
            drafts.add(Drafts.of(source, start, end, meta));
        }
        return drafts;
    }

    /**
     * Entries as units; an entry too large for one chunk is broken back into its lines.
     */
    private static List<Unit> entries(final String source, final int start, final int end, final int maxTokens) {
        final List<Unit> lines = Drafts.lines(source, start, end);
        final List<List<Unit>> grouped = new ArrayList<>();
        for (final Unit line : lines) {
            final boolean startsEntry = ENTRY_START.matcher(source.substring(line.start(), line.end())).find();
            if (grouped.isEmpty() || startsEntry) {
                grouped.add(new ArrayList<>());
            }
            grouped.get(grouped.size() - 1).add(line);
        }

        final List<Unit> entries = new ArrayList<>();
        for (final List<Unit> entry : grouped) {
            int tokens = 0;
            for (final Unit line : entry) {
                tokens += line.tokens();
            }
            if (tokens > maxTokens) {
                for (final Unit line : entry) {
                    if (line.tokens() > maxTokens) {
                        entries.addAll(Drafts.tokenWindows(source, line.start(), line.end(), maxTokens));
                    } else {
                        entries.add(line);
                    }
                }
            } else {
                entries.add(new Unit(entry.get(0).start(), entry.get(entry.size() - 1).end(), tokens, entry.size()));
            }
        }
        return entries;
    }

    private static List<String> timestamps(final String text) {
        final List<String> stamps = new ArrayList<>();
        for (final String line : text.split("\n")) {
            final Matcher m = TIMESTAMP.matcher(line);
            if (m.find() && m.start() < 4) {
                stamps.add(m.group());
            }
        }
        return stamps;
    }
}
