package eu.virtualparadox.knowledgebase.ingest.chunker;

import eu.virtualparadox.knowledgebase.ingest.token.TokenCounter;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits prose into contiguous sentence units.
 * <p>
 * A sentence ends at {@code .}, {@code !} or {@code ?} followed by whitespace and an
 * uppercase letter or quote, unless the text right before the boundary is a known
 * abbreviation ({@code Dr.}, {@code Inc.}, months ...). Blank lines always end a sentence.
 * The whitespace after a sentence belongs to it, so units tile the region without gaps.
 */
final class SentenceSplitter {

    /**
     * <pre>
     *     (?&lt;=[.!?])     # trailing ., ! or ? must precede the split
     *     (?![.!?])        # runs of punctuation split once
     *     \s+              # the divider
     *     (?=[\p{Lu}"'])   # next sentence starts with uppercase/quote
     * </pre>
     * or a paragraph break.
     */
    private static final Pattern SENTENCE_SPLIT = Pattern.compile(
            "(?<=[.!?])(?![.!?])\\s+(?=[\\p{Lu}\"'])|\\n[ \\t]*\\n\\s*");

    private static final Pattern ABBREVIATION_PATTERN = Pattern.compile(
            "\\b(?:Dr|Mr|Mrs|Ms|Prof|Sr|Jr|Inc|Ltd|Corp|Co|St|Ave|Blvd|Rd|etc|vs|eg|ie|cf|ca|approx|Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec|Mon|Tue|Wed|Thu|Fri|Sat|Sun|U\\.S\\.A|U\\.K|U\\.N)\\.$"
    );

    private SentenceSplitter() {
    }

    static List<Unit> split(final String source, final int start, final int end) {
        final List<Unit> sentences = new ArrayList<>();
        final Matcher matcher = SENTENCE_SPLIT.matcher(source).region(start, end);

        int sentenceStart = start;
        while (matcher.find()) {
            final int splitPoint = matcher.start();
            final boolean paragraphBreak = source.charAt(splitPoint) == '\n'
                    && source.substring(splitPoint, matcher.end()).chars().filter(c -> c == '\n').count() >= 2;
            if (!paragraphBreak) {
                final String beforeSplit = source.substring(Math.max(start, splitPoint - 20), splitPoint).trim();
                if (ABBREVIATION_PATTERN.matcher(beforeSplit).find()) {
                    continue;
                }
            }
            if (matcher.end() > sentenceStart && splitPoint > sentenceStart) {
                sentences.add(new Unit(sentenceStart, matcher.end(), TokenCounter.count(source, sentenceStart, matcher.end())));
                sentenceStart = matcher.end();
            }
        }
        if (sentenceStart < end) {
            sentences.add(new Unit(sentenceStart, end, TokenCounter.count(source, sentenceStart, end)));
        }
        return sentences;
    }
}
