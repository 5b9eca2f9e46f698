package eu.virtualparadox.knowledgebase.ingest.token;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Model-independent token estimate: a token is a run of word characters or a single
 * punctuation/symbol character. Chunk size bounds are expressed in these tokens.
 */
public final class TokenCounter {

    private static final Pattern TOKEN = Pattern.compile("\\w+|[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);

    private TokenCounter() {
        // prevent instantiation
    }

    public static int count(final CharSequence text) {
        return count(text, 0, text.length());
    }

    public static int count(final CharSequence text, final int start, final int end) {
        final Matcher m = TOKEN.matcher(text).region(start, end);
        int n = 0;
        while (m.find()) {
            n++;
        }
        return n;
    }

    public static List<TokenSpan> spans(final CharSequence text, final int start, final int end) {
        final Matcher m = TOKEN.matcher(text).region(start, end);
        final List<TokenSpan> spans = new ArrayList<>();
        while (m.find()) {
            spans.add(new TokenSpan(m.start(), m.end()));
        }
        return spans;
    }
}
