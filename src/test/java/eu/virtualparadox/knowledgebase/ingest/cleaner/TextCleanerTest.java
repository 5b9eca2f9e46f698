package eu.virtualparadox.knowledgebase.ingest.cleaner;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TextCleaner}.
 *
 * These tests cover line endings, control chars, non-breaking spaces,
 * zero-width characters and the preservation of line structure.
 */
class TextCleanerTest {

    private TextCleaner cleaner;

    @BeforeEach
    void setUp() {
        cleaner = new TextCleaner();
    }

    @Test
    void testSimpleTextIsUnchanged() {
        assertThat(cleaner.clean("Dragons are dangerous creatures.")).isEqualTo("Dragons are dangerous creatures.");
    }

    @Test
    void testNullAndEmptyBecomeEmpty() {
        assertThat(cleaner.clean(null)).isEmpty();
        assertThat(cleaner.clean("")).isEmpty();
    }

    @Test
    void testLineBreaksAreKept() {
        assertThat(cleaner.clean("volcanic\neruptions")).isEqualTo("volcanic\neruptions");
    }

    @Test
    void testCrLfAndCrBecomeLf() {
        assertThat(cleaner.clean("line1\r\n\r\nline2\rline3")).isEqualTo("line1\n\nline2\nline3");
    }

    @Test
    void testIndentationAndTabsAreKept() {
        final String code = "def f():\n\treturn 1\n    # done";
        assertThat(cleaner.clean(code)).isEqualTo(code);
    }

    @Test
    void testControlCharactersAreRemoved() {
        assertThat(cleaner.clean("valid\u0007text")).isEqualTo("validtext");
    }

    @Test
    void testNonBreakingSpaceIsNormalized() {
        assertThat(cleaner.clean("word1\u00A0word2")).isEqualTo("word1 word2");
    }

    @Test
    void testZeroWidthAndBomAreRemoved() {
        assertThat(cleaner.clean("\uFEFFzero\u200Bwidth\u200Djoin")).isEqualTo("zerowidthjoin");
    }

    @Test
    void testComposedFormIsProduced() {
        // e + combining acute accent
        assertThat(cleaner.clean("cafe\u0301")).isEqualTo("caf\u00E9");
    }

    @Test
    void testLeadingBlankLinesAndTrailingWhitespaceAreTrimmed() {
        assertThat(cleaner.clean("\n\nfirst line\n  second\n\n  ")).isEqualTo("first line\n  second");
    }
}
