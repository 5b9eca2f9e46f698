package eu.virtualparadox.knowledgebase.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContentHasherTest {

    @Test
    void testSha256OfKnownInput() {
        assertThat(ContentHasher.sha256("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void testDocumentIdIsStableAndScopedByKnowledgeBase() {
        final String id = ContentHasher.documentId("default", "docs/readme.md");
        assertThat(id).hasSize(32).isEqualTo(ContentHasher.documentId("default", "docs/readme.md"));
        assertThat(ContentHasher.documentId("other", "docs/readme.md")).isNotEqualTo(id);
    }
}
