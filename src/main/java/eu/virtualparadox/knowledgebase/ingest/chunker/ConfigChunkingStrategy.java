package eu.virtualparadox.knowledgebase.ingest.chunker;

import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;
import eu.virtualparadox.knowledgebase.ingest.model.ChunkDraft;
import eu.virtualparadox.knowledgebase.ingest.model.ChunkMetadata;
import eu.virtualparadox.knowledgebase.ingest.token.TokenCounter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits configuration at logical blocks: top-level keys and sections for YAML, TOML, INI and
 * properties; top-level members for JSON. Blocks are packed without overlap. Comments directly
 * above a key travel with it. Malformed JSON is rejected so the caller can fall back.
 */
@Component
public class ConfigChunkingStrategy implements ChunkingStrategy {

    public static final String NAME = "config-blocks";

    private static final Pattern TOP_LEVEL_KEY = Pattern.compile("^([\\w.\\-\"']+)\\s*[:=].*");
    private static final Pattern SECTION = Pattern.compile("^\\[{1,2}\\s*([^\\]]+?)\\s*]{1,2}\\s*$");
    private static final Pattern COMMENT = Pattern.compile("^\\s*[#;!].*|^\\s*//.*");
    private static final Pattern JSON_KEY = Pattern.compile("^[\\s,{\\[]*\"((?:[^\"\\\\]|\\\\.)*)\"\\s*:");

    @Override
    public DocumentClass documentClass() {
        return DocumentClass.CONFIG;
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
        final String trimmed = region.text().strip();
        final boolean json = trimmed.startsWith("{") || trimmed.startsWith("[");
        final String format = json ? "json" : lineFormat(trimmed);

        final List<Unit> blocks = new ArrayList<>();
        final List<String> keys = new ArrayList<>();
        if (json) {
            jsonBlocks(source, region.start(), region.end(), blocks, keys);
        } else {
            lineBlocks(source, region.start(), region.end(), blocks, keys);
        }

        // oversized blocks fall apart into lines, keeping their key
        final List<Unit> units = new ArrayList<>();
        final List<String> unitKeys = new ArrayList<>();
        for (int i = 0; i < blocks.size(); i++) {
            final Unit block = blocks.get(i);
            if (block.tokens() > profile.maxTokens()) {
                for (final Unit line : Drafts.lines(source, block.start(), block.end())) {
                    final List<Unit> pieces = line.tokens() > profile.maxTokens()
                            ? Drafts.tokenWindows(source, line.start(), line.end(), profile.maxTokens())
                            : List.of(line);
                    for (final Unit piece : pieces) {
                        units.add(piece);
                        unitKeys.add(keys.get(i));
                    }
                }
            } else {
                units.add(block);
                unitKeys.add(keys.get(i));
            }
        }

        final List<int[]> groups = UnitPacker.pack(units, profile.minTokens(), profile.maxTokens(), UnitPacker.NO_OVERLAP);
        final List<ChunkDraft> drafts = new ArrayList<>(groups.size());
        for (final int[] group : groups) {
            final Set<String> groupKeys = new LinkedHashSet<>();
            for (int u = group[0]; u < group[1]; u++) {
                if (unitKeys.get(u) != null) {
                    groupKeys.add(unitKeys.get(u));
                }
            }
            final Map<String, Object> meta = Drafts.meta(NAME);
            meta.put(ChunkMetadata.CONFIG_FORMAT, format);
            meta.put(ChunkMetadata.CONFIG_KEYS, List.copyOf(groupKeys));
            drafts.add(Drafts.of(source, UnitPacker.start(units, group), UnitPacker.end(units, group), meta));
        }
        return drafts;
    }

    private static String lineFormat(final String text) {
        for (final String line : text.split("\n")) {
            if (COMMENT.matcher(line).matches() || line.isBlank()) {
                continue;
            }
            if (SECTION.matcher(line.strip()).matches()) {
                return "ini";
            }
            return line.contains("=") && !line.contains(":") ? "properties" : "yaml";
        }
        return "yaml";
    }

    /**
     * Top-level blocks of a line-oriented format. A block starts at an unindented key,
     * section header, list item or document separator; preceding comments and blank lines
     * are pulled into it.
     */
    private static void lineBlocks(final String source, final int start, final int end,
                                   final List<Unit> blocks, final List<String> keys) {
        final List<Unit> lines = Drafts.lines(source, start, end);
        final List<Integer> starts = new ArrayList<>();
        final List<String> names = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            final String line = source.substring(lines.get(i).start(), lines.get(i).end()).stripTrailing();
            if (line.isEmpty() || Character.isWhitespace(line.charAt(0)) || COMMENT.matcher(line).matches()) {
                continue;
            }
            final String key = topLevelName(line);
            if (key == null) {
                continue;
            }
            // pull directly preceding comments into this block
            int first = i;
            while (first > 0) {
                final String above = source.substring(lines.get(first - 1).start(), lines.get(first - 1).end());
                if (!COMMENT.matcher(above.stripTrailing()).matches()) {
                    break;
                }
                first--;
            }
            if (!starts.isEmpty() && first <= starts.get(starts.size() - 1)) {
                first = i;
            }
            starts.add(first);
            names.add(key);
        }

        if (starts.isEmpty() || starts.get(0) != 0) {
            starts.add(0, 0);
            names.add(0, null);
        }
        for (int b = 0; b < starts.size(); b++) {
            final int from = lines.get(starts.get(b)).start();
            final int to = b + 1 < starts.size() ? lines.get(starts.get(b + 1)).start() : end;
            if (from >= to) {
                continue;
            }
            blocks.add(new Unit(from, to, TokenCounter.count(source, from, to)));
            keys.add(names.get(b));
        }
        mergeLeadingFragment(blocks, keys);
    }

    private static String topLevelName(final String line) {
        final Matcher section = SECTION.matcher(line);
        if (section.matches()) {
            return section.group(1);
        }
        if (line.startsWith("---")) {
            return "---";
        }
        if (line.startsWith("- ")) {
            return "-";
        }
        final Matcher key = TOP_LEVEL_KEY.matcher(line);
        if (key.matches()) {
            return key.group(1).replace("\"", "").replace("'", "");
        }
        return null;
    }

    /**
     * Top-level members of a JSON object (or elements of a JSON array). The opening bracket
     * rides with the first member and the closing bracket with the last.
     */
    private static void jsonBlocks(final String source, final int start, final int end,
                                   final List<Unit> blocks, final List<String> keys) {
        int depth = 0;
        boolean inString = false;
        boolean sawRoot = false;
        int blockStart = start;

        for (int i = start; i < end; i++) {
            final char c = source.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '{', '[' -> {
                    depth++;
                    sawRoot = true;
                }
                case '}', ']' -> {
                    depth--;
                    if (depth < 0) {
                        throw new IllegalArgumentException("unbalanced JSON at offset " + i);
                    }
                }
                case ',' -> {
                    if (depth == 1) {
                        int next = i + 1;
                        // the line break after a comma stays with the member it ends
                        while (next < end && source.charAt(next) != '\n' && Character.isWhitespace(source.charAt(next))) {
                            next++;
                        }
                        if (next < end && source.charAt(next) == '\n') {
                            next++;
                        }
                        addJsonBlock(source, blockStart, next, blocks, keys);
                        blockStart = next;
                    }
                }
                default -> {
                    // other characters do not affect structure
                }
            }
        }
        if (inString || depth != 0 || !sawRoot) {
            throw new IllegalArgumentException("malformed JSON document");
        }
        addJsonBlock(source, blockStart, end, blocks, keys);
    }

    private static void addJsonBlock(final String source, final int from, final int to,
                                     final List<Unit> blocks, final List<String> keys) {
        if (from >= to) {
            return;
        }
        final Matcher key = JSON_KEY.matcher(source.substring(from, to));
        blocks.add(new Unit(from, to, TokenCounter.count(source, from, to)));
        keys.add(key.find() ? key.group(1) : null);
    }

    /**
     * A leading block with no key (file header comments) joins the first keyed block.
     */
    private static void mergeLeadingFragment(final List<Unit> blocks, final List<String> keys) {
        if (blocks.size() > 1 && keys.get(0) == null) {
            final Unit head = blocks.remove(0);
            final Unit next = blocks.remove(0);
            blocks.add(0, new Unit(head.start(), next.end(), head.tokens() + next.tokens()));
            keys.remove(0);
        }
    }
}
