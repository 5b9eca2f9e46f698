package eu.virtualparadox.knowledgebase.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers used for change detection and for deriving stable document ids.
 */
public final class ContentHasher {

    private ContentHasher() {
        // prevent instantiation
    }

    /**
     * @return lowercase hex SHA-256 of the UTF-8 bytes of {@code content} (64 characters)
     */
    public static String sha256(final String content) {
        try {
            final MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Stable document id for an origin inside a knowledge base, so that re-ingesting the
     * same origin targets the same document.
     */
    public static String documentId(final String knowledgeBase, final String origin) {
        return sha256(knowledgeBase + "\u0000" + origin).substring(0, 32);
    }
}
