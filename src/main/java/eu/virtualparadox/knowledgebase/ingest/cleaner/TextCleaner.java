package eu.virtualparadox.knowledgebase.ingest.cleaner;

import org.springframework.stereotype.Component;

import java.text.Normalizer;

/**
 * Normalizes incoming text before hashing and chunking.
 * <p>
 * Unlike whitespace-collapsing cleaners this one keeps line structure intact, since code,
 * tables, configuration and logs depend on it. Chunk offsets always refer to the cleaned text.
 */
@Component
public class TextCleaner {

    /**
     * @param input raw text, may be {@code null}
     * @return NFC-normalized text with LF line endings and without invisible characters
     */
    public String clean(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }

        final String nfc = Normalizer.normalize(input, Normalizer.Form.NFC)
                // line endings -> LF
                .replace("\r\n", "\n")
                .replace('\r', '\n');

        final StringBuilder sb = new StringBuilder(nfc.length());
        for (int i = 0; i < nfc.length(); i++) {
            final char c = nfc.charAt(i);
            if (c == '\n' || c == '\t') {
                sb.append(c);
            } else if (c == '\u00A0' || c == '\u202F' || c == '\u2007') {
                sb.append(' ');
            } else if (Character.getType(c) != Character.FORMAT && Character.getType(c) != Character.CONTROL) {
                // zero-width, BOM, soft hyphen and control chars fall through and are dropped
                sb.append(c);
            }
        }
        return trimBlankEdges(sb);
    }

    private String trimBlankEdges(final StringBuilder sb) {
        int end = sb.length();
        while (end > 0 && Character.isWhitespace(sb.charAt(end - 1))) {
            end--;
        }
        int start = 0;
        while (start < end && sb.charAt(start) == '\n') {
            start++;
        }
        return sb.substring(start, end);
    }
}
