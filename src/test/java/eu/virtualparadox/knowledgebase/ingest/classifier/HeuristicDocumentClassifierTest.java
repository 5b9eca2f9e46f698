package eu.virtualparadox.knowledgebase.ingest.classifier;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HeuristicDocumentClassifierTest {

    private final HeuristicDocumentClassifier classifier = new HeuristicDocumentClassifier();

    @Test
    void testExtensionDecidesFirst() {
        assertThat(classifier.classify("anything", "notes/readme.md")).isEqualTo(DocumentClass.MARKDOWN);
        assertThat(classifier.classify("anything", "src/app.py")).isEqualTo(DocumentClass.CODE);
        assertThat(classifier.classify("anything", "C:\\data\\export.CSV")).isEqualTo(DocumentClass.TABLE);
        assertThat(classifier.classify("anything", "deploy/values.yaml")).isEqualTo(DocumentClass.CONFIG);
    }

    @Test
    void testUnknownExtensionFallsBackToContent() {
        final String log = String.join("\n",
                "2024-01-01 10:00:00 INFO Starting service",
                "2024-01-01 10:00:01 WARN Slow response from db",
                "2024-01-01 10:00:02 ERROR Connection refused");
        assertThat(classifier.classify(log, "output.txt.bak")).isEqualTo(DocumentClass.LOG);
    }

    @Test
    void testProseIsText() {
        final String prose = String.join("\n",
                "The quick brown fox jumps over the lazy dog near the river bank.",
                "It was a calm evening and everyone in the village was asleep already.");
        assertThat(classifier.classify(prose)).isEqualTo(DocumentClass.TEXT);
    }

    @Test
    void testHeadersAndListsAreMarkdown() {
        final String markdown = String.join("\n",
                "# Title",
                "",
                "Some intro paragraph with enough words to count here.",
                "",
                "## Section",
                "",
                "- item one",
                "- item two");
        assertThat(classifier.classify(markdown)).isEqualTo(DocumentClass.MARKDOWN);
    }

    @Test
    void testFunctionBodyIsCode() {
        final String code = String.join("\n",
                "function add(a, b) {",
                "  return a + b;",
                "}");
        assertThat(classifier.classify(code)).isEqualTo(DocumentClass.CODE);
    }

    @Test
    void testRegularDelimitersAreTable() {
        final String csv = String.join("\n",
                "name,age,city",
                "alice,31,berlin",
                "bob,42,paris",
                "carol,27,rome");
        assertThat(classifier.classify(csv)).isEqualTo(DocumentClass.TABLE);
    }

    @Test
    void testCompetingSignalsAreMixed() {
        final String mixed = String.join("\n",
                "2024-01-01 10:00:00 INFO Starting service",
                "2024-01-01 10:00:01 WARN Slow response from db",
                "The deployment finished without any visible problems today",
                "Operators should still review the dashboards before the weekend");
        assertThat(classifier.classify(mixed)).isEqualTo(DocumentClass.MIXED);
    }

    @Test
    void testBlankSampleIsMixed() {
        assertThat(classifier.classify("   \n ")).isEqualTo(DocumentClass.MIXED);
    }

    @Test
    void testLineClassOfSingleLines() {
        assertThat(HeuristicDocumentClassifier.lineClass("   ")).isNull();
        assertThat(HeuristicDocumentClassifier.lineClass("## Setup")).isEqualTo(DocumentClass.MARKDOWN);
        assertThat(HeuristicDocumentClassifier.lineClass("| a | b |")).isEqualTo(DocumentClass.TABLE);
        assertThat(HeuristicDocumentClassifier.lineClass("2024-01-01 10:00:00 INFO x")).isEqualTo(DocumentClass.LOG);
        assertThat(HeuristicDocumentClassifier.lineClass("key: value")).isEqualTo(DocumentClass.CONFIG);
        assertThat(HeuristicDocumentClassifier.lineClass("return x;")).isEqualTo(DocumentClass.CODE);
    }
}
