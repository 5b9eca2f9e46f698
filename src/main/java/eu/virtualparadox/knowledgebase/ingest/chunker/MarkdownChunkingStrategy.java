package eu.virtualparadox.knowledgebase.ingest.chunker;

import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;
import eu.virtualparadox.knowledgebase.ingest.model.ChunkDraft;
import eu.virtualparadox.knowledgebase.ingest.model.ChunkMetadata;
import eu.virtualparadox.knowledgebase.ingest.token.TokenCounter;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Section-aligned markdown chunking.
 * <ul>
 *   <li>Every ATX header ({@code #} .. {@code ######}) outside a fenced block opens a section.
 *       Sections are never merged with each other, except that a section holding nothing but
 *       its header is folded into the following one.</li>
 *   <li>A section within {@code maxTokens} becomes one chunk. Larger sections are packed from
 *       blocks (paragraphs, lists, fenced code) with token overlap.</li>
 *   <li>A fenced code block is never split, even when it alone exceeds {@code maxTokens}.</li>
 * </ul>
 */
@Component
public class MarkdownChunkingStrategy implements ChunkingStrategy {

    public static final String NAME = "markdown-sections";

    private static final Pattern HEADER = Pattern.compile("^(#{1,6})\\s+(.*?)\\s*#*\\s*$");
    private static final Pattern FENCE = Pattern.compile("^ {0,3}(`{3,}|~{3,})");

    @Override
    public DocumentClass documentClass() {
        return DocumentClass.MARKDOWN;
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
        final List<Line> lines = lines(source, region.start(), region.end());
        final List<Section> sections = sections(lines, region);

        final List<ChunkDraft> drafts = new ArrayList<>();
        for (final Section section : sections) {
            final Map<String, Object> meta = Drafts.meta(NAME);
            if (!section.headerPath().isEmpty()) {
                meta.put(ChunkMetadata.HEADER_PATH, section.headerPath());
                meta.put(ChunkMetadata.HEADER_LEVEL, section.level());
            }
            if (TokenCounter.count(source, section.start(), section.end()) <= profile.maxTokens()) {
                drafts.add(Drafts.of(source, section.start(), section.end(), meta));
                continue;
            }
            final List<Unit> units = blockUnits(source, lines, section, profile.maxTokens());
            final List<int[]> groups = UnitPacker.pack(units, profile.minTokens(), profile.maxTokens(),
                    UnitPacker.overlapTokens(profile.overlap()));
            drafts.addAll(Drafts.fromGroups(source, units, groups, meta));
        }
        return drafts;
    }

    private record Line(int start, int end, boolean blank, boolean fence, int headerLevel, String headerTitle) {
    }

    private record Section(int start, int end, String headerPath, int level) {
    }

    private static List<Line> lines(final String source, final int start, final int end) {
        final List<Line> lines = new ArrayList<>();
        String openFence = null;
        int s = start;
        while (s < end) {
            final int nl = source.indexOf('\n', s);
            final int e = (nl < 0 || nl >= end) ? end : nl + 1;
            final String text = source.substring(s, e).stripTrailing();

            final Matcher fence = FENCE.matcher(text);
            if (fence.find()) {
                final String marker = fence.group(1);
                if (openFence == null) {
                    openFence = marker;
                    lines.add(new Line(s, e, false, true, 0, null));
                } else if (marker.charAt(0) == openFence.charAt(0) && marker.length() >= openFence.length()
                        && text.trim().length() == marker.length()) {
                    openFence = null;
                    lines.add(new Line(s, e, false, true, 0, null));
                } else {
                    lines.add(new Line(s, e, false, false, 0, null));
                }
            } else if (openFence != null) {
                lines.add(new Line(s, e, text.isBlank(), false, 0, null));
            } else {
                final Matcher header = HEADER.matcher(text);
                if (header.matches()) {
                    lines.add(new Line(s, e, false, false, header.group(1).length(), header.group(2)));
                } else {
                    lines.add(new Line(s, e, text.isBlank(), false, 0, null));
                }
            }
            s = e;
        }
        return lines;
    }

    /**
     * Header-delimited sections, with header-only sections folded forward and a blank
     * preamble folded into the first section.
     */
    private static List<Section> sections(final List<Line> lines, final TextRegion region) {
        final Deque<String[]> stack = new ArrayDeque<>();
        final List<int[]> bounds = new ArrayList<>();
        final List<String> paths = new ArrayList<>();
        final List<Integer> levels = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            final Line line = lines.get(i);
            if (line.headerLevel() > 0) {
                while (!stack.isEmpty() && Integer.parseInt(stack.peek()[0]) >= line.headerLevel()) {
                    stack.pop();
                }
                stack.push(new String[]{String.valueOf(line.headerLevel()), line.headerTitle()});
                bounds.add(new int[]{i, lines.size()});
                paths.add(headerPath(stack));
                levels.add(line.headerLevel());
            }
        }
        for (int b = 0; b < bounds.size() - 1; b++) {
            bounds.get(b)[1] = bounds.get(b + 1)[0];
        }

        final List<Section> raw = new ArrayList<>();
        final int firstHeader = bounds.isEmpty() ? lines.size() : bounds.get(0)[0];
        if (firstHeader > 0) {
            raw.add(new Section(region.start(), lines.get(firstHeader - 1).end(), "", 0));
        }
        for (int b = 0; b < bounds.size(); b++) {
            final int[] bound = bounds.get(b);
            raw.add(new Section(lines.get(bound[0]).start(), lines.get(bound[1] - 1).end(), paths.get(b), levels.get(b)));
        }

        final List<Section> merged = new ArrayList<>();
        Integer carryStart = null;
        for (int i = 0; i < raw.size(); i++) {
            final Section section = raw.get(i);
            final boolean last = i == raw.size() - 1;
            final boolean preamble = section.level() == 0;
            final boolean empty = preamble
                    ? isBlank(region.source(), section.start(), section.end())
                    : headerOnly(lines, section);
            if (empty && !last) {
                if (carryStart == null) {
                    carryStart = section.start();
                }
                continue;
            }
            final int start = carryStart == null ? section.start() : carryStart;
            carryStart = null;
            if (empty && !merged.isEmpty()) {
                final Section prev = merged.remove(merged.size() - 1);
                merged.add(new Section(prev.start(), section.end(), prev.headerPath(), prev.level()));
            } else {
                merged.add(new Section(start, section.end(), section.headerPath(), section.level()));
            }
        }
        return merged;
    }

    private static boolean headerOnly(final List<Line> lines, final Section section) {
        for (final Line line : lines) {
            if (line.start() > section.start() && line.start() < section.end() && !line.blank()) {
                return false;
            }
        }
        return true;
    }

    private static boolean isBlank(final String source, final int start, final int end) {
        return source.substring(start, end).isBlank();
    }

    private static String headerPath(final Deque<String[]> stack) {
        final List<String> titles = new ArrayList<>();
        stack.descendingIterator().forEachRemaining(entry -> titles.add(entry[1]));
        return titles.stream().collect(Collectors.joining(" > "));
    }

    /**
     * Paragraph, list and fence blocks of a section. The header line rides with the first block;
     * trailing blank lines ride with the block before them.
     */
    private static List<Unit> blockUnits(final String source,
                                         final List<Line> lines,
                                         final Section section,
                                         final int maxTokens) {
        final List<Unit> units = new ArrayList<>();
        int current = section.start();
        boolean hasContent = false;
        boolean isFence = false;
        boolean pendingBreak = false;
        boolean inFence = false;

        for (final Line line : lines) {
            if (line.start() < section.start() || line.start() >= section.end()) {
                continue;
            }
            if (inFence) {
                if (line.fence()) {
                    inFence = false;
                    pendingBreak = true;
                }
                continue;
            }
            if (line.fence()) {
                if (hasContent) {
                    addBlock(units, source, current, line.start(), isFence, maxTokens);
                    current = line.start();
                }
                hasContent = true;
                isFence = true;
                inFence = true;
                pendingBreak = false;
                continue;
            }
            if (line.blank()) {
                pendingBreak = hasContent;
                continue;
            }
            if (line.headerLevel() > 0) {
                continue;
            }
            if (pendingBreak) {
                addBlock(units, source, current, line.start(), isFence, maxTokens);
                current = line.start();
                isFence = false;
            }
            hasContent = true;
            pendingBreak = false;
        }
        addBlock(units, source, current, section.end(), isFence, maxTokens);
        return units;
    }

    private static void addBlock(final List<Unit> units,
                                 final String source,
                                 final int start,
                                 final int end,
                                 final boolean fence,
                                 final int maxTokens) {
        if (start >= end) {
            return;
        }
        final int tokens = TokenCounter.count(source, start, end);
        if (tokens > maxTokens && !fence) {
            units.addAll(TextChunkingStrategy.sentenceUnits(source, start, end, maxTokens));
        } else {
            units.add(new Unit(start, end, tokens));
        }
    }
}
