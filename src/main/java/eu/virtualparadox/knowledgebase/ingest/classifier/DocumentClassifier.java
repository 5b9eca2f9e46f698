package eu.virtualparadox.knowledgebase.ingest.classifier;

/**
 * Assigns a {@link DocumentClass} to a bounded prefix of a document.
 * <p>
 * Implementations are total: when nothing matches decisively they answer
 * {@link DocumentClass#MIXED}. A wrong answer only affects chunk quality.
 */
public interface DocumentClassifier {

    /**
     * @param sample leading part of the content
     * @param origin file name or URL of the document, may be {@code null}
     */
    DocumentClass classify(String sample, String origin);

    default DocumentClass classify(final String sample) {
        return classify(sample, null);
    }
}
