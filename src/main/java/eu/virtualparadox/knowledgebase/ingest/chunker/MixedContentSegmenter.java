package eu.virtualparadox.knowledgebase.ingest.chunker;

import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;
import eu.virtualparadox.knowledgebase.ingest.classifier.HeuristicDocumentClassifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits mixed content into homogeneous regions.
 * <p>
 * Each line is labelled with the class it signals. Fenced blocks are code; a markdown header
 * pulls the prose lines after it into a markdown region; blank lines join the region they
 * follow. Runs of equally labelled lines form regions, and regions shorter than
 * {@value #MIN_REGION_LINES} non-blank lines are absorbed by their predecessor.
 */
@Component
public class MixedContentSegmenter {

    static final int MIN_REGION_LINES = 2;

    private static final Pattern FENCE = Pattern.compile("^ {0,3}(?:`{3,}|~{3,}).*");
    private static final Pattern HEADER = Pattern.compile("^#{1,6}\\s+\\S.*");

    /**
     * A homogeneous part {@code [start, end)} of the source.
     */
    public record Segment(DocumentClass documentClass, int start, int end) {
    }

    private static final class Run {
        private DocumentClass documentClass;
        private final int start;
        private int end;
        private int lines;

        private Run(final DocumentClass documentClass, final int start, final int end, final int lines) {
            this.documentClass = documentClass;
            this.start = start;
            this.end = end;
            this.lines = lines;
        }
    }

    public List<Segment> segment(final TextRegion region) {
        final String source = region.source();
        final List<Run> runs = new ArrayList<>();
        boolean inFence = false;
        boolean inMarkdown = false;

        for (final Unit line : Drafts.lines(source, region.start(), region.end())) {
            final String text = source.substring(line.start(), line.end()).stripTrailing();
            DocumentClass label;
            if (FENCE.matcher(text).matches()) {
                label = DocumentClass.CODE;
                inFence = !inFence;
            } else if (inFence) {
                label = DocumentClass.CODE;
            } else if (HEADER.matcher(text).matches()) {
                label = DocumentClass.MARKDOWN;
                inMarkdown = true;
            } else {
                label = HeuristicDocumentClassifier.lineClass(text);
                if (label == DocumentClass.TEXT && inMarkdown) {
                    label = DocumentClass.MARKDOWN;
                } else if (label != null && label != DocumentClass.TEXT && label != DocumentClass.MARKDOWN) {
                    inMarkdown = false;
                }
            }

            if (label == null) {
                if (runs.isEmpty()) {
                    runs.add(new Run(null, line.start(), line.end(), 0));
                } else {
                    runs.get(runs.size() - 1).end = line.end();
                }
                continue;
            }
            final Run last = runs.isEmpty() ? null : runs.get(runs.size() - 1);
            if (last != null && (last.documentClass == label || last.documentClass == null)) {
                last.documentClass = label;
                last.end = line.end();
                last.lines++;
            } else {
                runs.add(new Run(label, line.start(), line.end(), 1));
            }
        }

        absorbShortRuns(runs);
        final List<Segment> segments = new ArrayList<>(runs.size());
        for (final Run run : runs) {
            segments.add(new Segment(run.documentClass == null ? DocumentClass.TEXT : run.documentClass, run.start, run.end));
        }
        return segments;
    }

    private static void absorbShortRuns(final List<Run> runs) {
        int i = 0;
        while (i < runs.size() && runs.size() > 1) {
            final Run run = runs.get(i);
            if (run.lines >= MIN_REGION_LINES) {
                i++;
                continue;
            }
            if (i > 0) {
                final Run previous = runs.get(i - 1);
                previous.end = run.end;
                previous.lines += run.lines;
                runs.remove(i);
            } else {
                final Run next = runs.get(1);
                if (next.lines < MIN_REGION_LINES) {
                    next.documentClass = run.documentClass;
                }
                runs.remove(0);
                runs.set(0, new Run(next.documentClass, run.start, next.end, run.lines + next.lines));
                continue;
            }
            // the merge may have made two equal neighbours adjacent
            if (i < runs.size() && runs.get(i - 1).documentClass == runs.get(i).documentClass) {
                final Run previous = runs.get(i - 1);
                previous.end = runs.get(i).end;
                previous.lines += runs.get(i).lines;
                runs.remove(i);
            }
        }
    }
}
