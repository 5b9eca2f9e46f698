package eu.virtualparadox.knowledgebase.ingest.classifier;

import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Deterministic classifier based on the file extension and on structural markers of the sample.
 *
 * <h3>Scoring</h3>
 * Every non-blank line of the sample votes for the classes whose markers it shows
 * (function/class keywords, delimiter regularity, markdown headers, key/value pairs,
 * timestamps, prose). Scores are the voting share per class. The best class wins when it
 * clearly dominates; two strong competing signals yield {@link DocumentClass#MIXED}.
 */
@Slf4j
public class HeuristicDocumentClassifier implements DocumentClassifier {

    private static final double DECISIVE = 0.6;
    private static final double MARGIN = 0.2;
    private static final double COMPETING = 0.25;
    private static final double WEAK = 0.35;

    private static final Map<String, DocumentClass> EXTENSIONS = Map.ofEntries(
            Map.entry("md", DocumentClass.MARKDOWN), Map.entry("markdown", DocumentClass.MARKDOWN),
            Map.entry("py", DocumentClass.CODE), Map.entry("js", DocumentClass.CODE),
            Map.entry("ts", DocumentClass.CODE), Map.entry("jsx", DocumentClass.CODE),
            Map.entry("tsx", DocumentClass.CODE), Map.entry("java", DocumentClass.CODE),
            Map.entry("kt", DocumentClass.CODE), Map.entry("go", DocumentClass.CODE),
            Map.entry("rs", DocumentClass.CODE), Map.entry("c", DocumentClass.CODE),
            Map.entry("h", DocumentClass.CODE), Map.entry("cpp", DocumentClass.CODE),
            Map.entry("hpp", DocumentClass.CODE), Map.entry("cs", DocumentClass.CODE),
            Map.entry("rb", DocumentClass.CODE), Map.entry("php", DocumentClass.CODE),
            Map.entry("swift", DocumentClass.CODE), Map.entry("scala", DocumentClass.CODE),
            Map.entry("sh", DocumentClass.CODE), Map.entry("sql", DocumentClass.CODE),
            Map.entry("json", DocumentClass.CONFIG), Map.entry("yaml", DocumentClass.CONFIG),
            Map.entry("yml", DocumentClass.CONFIG), Map.entry("toml", DocumentClass.CONFIG),
            Map.entry("ini", DocumentClass.CONFIG), Map.entry("env", DocumentClass.CONFIG),
            Map.entry("properties", DocumentClass.CONFIG), Map.entry("conf", DocumentClass.CONFIG),
            Map.entry("csv", DocumentClass.TABLE), Map.entry("tsv", DocumentClass.TABLE),
            Map.entry("log", DocumentClass.LOG));

    static final Pattern MD_HEADER = Pattern.compile("^#{1,6}\\s+\\S.*");
    static final Pattern MD_FENCE = Pattern.compile("^\\s*(```|~~~).*");
    private static final Pattern MD_LIST = Pattern.compile("^\\s*(?:[-*+]|\\d+\\.)\\s+\\S.*");
    private static final Pattern MD_LINK = Pattern.compile(".*\\[[^\\]]+]\\([^)]+\\).*");
    private static final Pattern CODE_LINE = Pattern.compile(
            "^\\s*(?:def |class |function\\b|func |fn |pub |public |private |protected |static |import |from \\S+ import|package |#include|using |const |let |var |return\\b|if\\s*\\(|for\\s*\\(|while\\s*\\(|}\\s*else).*"
                    + "|.*[{};]\\s*$|.*\\)\\s*:\\s*$");
    static final Pattern LOG_LINE = Pattern.compile(
            "^\\[?(?:\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}:\\d{2}|\\w{3}\\s+\\d{1,2}\\s+\\d{2}:\\d{2}:\\d{2}|\\d{2}:\\d{2}:\\d{2}[.,]\\d{3})"
                    + "|^\\[?(?:TRACE|DEBUG|INFO|WARN|WARNING|ERROR|FATAL)\\b.*");
    static final Pattern CONFIG_LINE = Pattern.compile(
            "^\\s*(?:[\\w.\\-\"']+\\s*[:=](?:\\s.*|\\s*)|\\[[\\w.\\- \"]+]|[{}\\[\\]],?)\\s*$");
    private static final Pattern JSON_LINE = Pattern.compile("^\\s*(?:\"[^\"]*\"\\s*:.*|[{}\\[\\]]\\s*,?)\\s*$");
    private static final Pattern PROSE_LINE = Pattern.compile("^(?:\\S+\\s+){5,}\\S+.*");

    @Override
    public DocumentClass classify(final String sample, final String origin) {
        final DocumentClass byExtension = byExtension(origin);
        if (byExtension != null) {
            return byExtension;
        }
        if (sample == null || sample.isBlank()) {
            return DocumentClass.MIXED;
        }
        final Map<DocumentClass, Double> scores = score(sample);
        final DocumentClass decided = decide(scores);
        log.debug("Heuristic scores {} -> {}", scores, decided);
        return decided;
    }

    static DocumentClass byExtension(final String origin) {
        if (origin == null) {
            return null;
        }
        final String name = origin.toLowerCase(Locale.ROOT);
        final int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        final int dot = name.lastIndexOf('.');
        if (dot <= slash || dot == name.length() - 1) {
            return null;
        }
        return EXTENSIONS.get(name.substring(dot + 1));
    }

    Map<DocumentClass, Double> score(final String sample) {
        final Map<DocumentClass, Integer> votes = new EnumMap<>(DocumentClass.class);
        int lines = 0;
        int headers = 0;
        boolean inFence = false;

        for (final String line : sample.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            lines++;
            if (MD_FENCE.matcher(line).matches()) {
                inFence = !inFence;
                vote(votes, DocumentClass.MARKDOWN);
                continue;
            }
            if (inFence) {
                vote(votes, DocumentClass.MARKDOWN);
                continue;
            }
            if (MD_HEADER.matcher(line).matches()) {
                headers++;
                vote(votes, DocumentClass.MARKDOWN);
                continue;
            }
            if (LOG_LINE.matcher(line).find()) {
                vote(votes, DocumentClass.LOG);
                continue;
            }
            if (MD_LIST.matcher(line).matches() || MD_LINK.matcher(line).matches()) {
                vote(votes, DocumentClass.MARKDOWN);
            }
            if (JSON_LINE.matcher(line).matches()) {
                vote(votes, DocumentClass.CONFIG);
            } else if (CODE_LINE.matcher(line).matches()) {
                vote(votes, DocumentClass.CODE);
            } else if (PROSE_LINE.matcher(line).matches()) {
                vote(votes, DocumentClass.TEXT);
            } else if (CONFIG_LINE.matcher(line).matches()) {
                vote(votes, DocumentClass.CONFIG);
            }
        }

        final Map<DocumentClass, Double> scores = new EnumMap<>(DocumentClass.class);
        if (lines == 0) {
            return scores;
        }
        for (final Map.Entry<DocumentClass, Integer> e : votes.entrySet()) {
            scores.put(e.getKey(), e.getValue() / (double) lines);
        }
        // markdown without any header is most likely prose with lists
        if (headers > 0) {
            scores.merge(DocumentClass.MARKDOWN, 0.3, (a, b) -> Math.min(1.0, a + b));
        }
        final double table = delimiterRegularity(sample);
        if (table > 0) {
            scores.put(DocumentClass.TABLE, table);
        }
        return scores;
    }

    /**
     * Share of non-blank lines that carry the modal number of a delimiter, for the most
     * regular delimiter. Commas and semicolons need at least two per line to count.
     */
    static double delimiterRegularity(final String sample) {
        final String[] lines = sample.lines().filter(l -> !l.isBlank()).toArray(String[]::new);
        if (lines.length < 2) {
            return 0.0;
        }
        double best = 0.0;
        for (final char delimiter : new char[]{',', '\t', '|', ';'}) {
            final Map<Integer, Integer> histogram = new HashMap<>();
            for (final String line : lines) {
                histogram.merge(countChar(line, delimiter), 1, Integer::sum);
            }
            int modal = 0;
            int modalCount = 0;
            for (final Map.Entry<Integer, Integer> e : histogram.entrySet()) {
                if (e.getKey() > 0 && e.getValue() > modalCount) {
                    modal = e.getKey();
                    modalCount = e.getValue();
                }
            }
            final int required = (delimiter == ',' || delimiter == ';') ? 2 : 1;
            if (modal >= required) {
                best = Math.max(best, modalCount / (double) lines.length);
            }
        }
        return best;
    }

    /**
     * Class a single line signals on its own, without any surrounding context.
     * Blank lines signal nothing and yield {@code null}.
     */
    public static DocumentClass lineClass(final String line) {
        if (line == null || line.isBlank()) {
            return null;
        }
        if (MD_HEADER.matcher(line).matches() || MD_FENCE.matcher(line).matches()) {
            return DocumentClass.MARKDOWN;
        }
        if (LOG_LINE.matcher(line).find()) {
            return DocumentClass.LOG;
        }
        final boolean prose = PROSE_LINE.matcher(line).matches();
        if (countChar(line, '|') >= 2 || countChar(line, '\t') >= 1 || (!prose && countChar(line, ',') >= 2)) {
            return DocumentClass.TABLE;
        }
        if (JSON_LINE.matcher(line).matches()) {
            return DocumentClass.CONFIG;
        }
        if (CODE_LINE.matcher(line).matches()) {
            return DocumentClass.CODE;
        }
        if (prose) {
            return DocumentClass.TEXT;
        }
        return CONFIG_LINE.matcher(line).matches() ? DocumentClass.CONFIG : DocumentClass.TEXT;
    }

    static int countChar(final String line, final char c) {
        int n = 0;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }

    private static DocumentClass decide(final Map<DocumentClass, Double> scores) {
        DocumentClass best = null;
        double bestScore = 0.0;
        double second = 0.0;
        // EnumMap iteration order keeps ties deterministic
        for (final Map.Entry<DocumentClass, Double> e : scores.entrySet()) {
            if (e.getValue() > bestScore) {
                second = bestScore;
                bestScore = e.getValue();
                best = e.getKey();
            } else if (e.getValue() > second) {
                second = e.getValue();
            }
        }
        if (best == null) {
            return DocumentClass.MIXED;
        }
        if (bestScore >= DECISIVE && bestScore - second >= MARGIN) {
            return best;
        }
        if (second >= COMPETING) {
            return DocumentClass.MIXED;
        }
        return bestScore >= WEAK ? best : DocumentClass.MIXED;
    }

    private static void vote(final Map<DocumentClass, Integer> votes, final DocumentClass documentClass) {
        votes.merge(documentClass, 1, Integer::sum);
    }
}
