package eu.virtualparadox.knowledgebase.ingest.chunker;

import eu.virtualparadox.knowledgebase.ingest.model.ChunkDraft;
import eu.virtualparadox.knowledgebase.ingest.model.ChunkMetadata;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MarkdownChunkingStrategyTest {

    private final MarkdownChunkingStrategy strategy = new MarkdownChunkingStrategy();

    @Test
    void testEachSectionBecomesOneChunk() {
        final String md = String.join("\n",
                "# Intro",
                "",
                "Welcome text here.",
                "",
                "## Install",
                "",
                "Run the installer.",
                "",
                "## Usage",
                "",
                "Call the api.",
                "");
        final List<ChunkDraft> drafts = strategy.chunk(TextRegion.whole(md, "guide.md"), new ChunkingProfile(0, 200, 0));

        assertThat(drafts).hasSize(3);
        assertThat(drafts.get(0).text()).startsWith("# Intro").contains("Welcome").doesNotContain("Install");
        assertThat(drafts.get(1).text()).startsWith("## Install").contains("Run the installer.");
        assertThat(drafts.get(2).endOffset()).isEqualTo(md.length());
        assertThat(drafts).extracting(d -> d.metadata().get(ChunkMetadata.HEADER_PATH))
                .containsExactly("Intro", "Intro > Install", "Intro > Usage");
        assertThat(drafts).extracting(d -> d.metadata().get(ChunkMetadata.HEADER_LEVEL))
                .containsExactly(1, 2, 2);
    }

    @Test
    void testHeaderOnlySectionIsFoldedForward() {
        final String md = "# Title\n## Sub\n\nBody text.\n";
        final List<ChunkDraft> drafts = strategy.chunk(TextRegion.whole(md, null), new ChunkingProfile(0, 200, 0));

        assertThat(drafts).hasSize(1);
        assertThat(drafts.get(0).startOffset()).isZero();
        assertThat(drafts.get(0).metadata()).containsEntry(ChunkMetadata.HEADER_PATH, "Title > Sub");
    }

    @Test
    void testFencedBlockIsNeverSplit() {
        final String md = "# Code\n\n```\na b c d e f g h i j k l\n```\n";
        final List<ChunkDraft> drafts = strategy.chunk(TextRegion.whole(md, null), new ChunkingProfile(0, 5, 0));

        assertThat(drafts).hasSize(1);
        assertThat(drafts.get(0).text()).contains("a b c d e f g h i j k l").endsWith("```\n");
    }

    @Test
    void testHashInsideFenceIsNotAHeader() {
        final String md = "# Script\n\n```\n# not a header\necho hi\n```\n";
        final List<ChunkDraft> drafts = strategy.chunk(TextRegion.whole(md, null), new ChunkingProfile(0, 200, 0));

        assertThat(drafts).hasSize(1);
        assertThat(drafts.get(0).metadata()).containsEntry(ChunkMetadata.HEADER_PATH, "Script");
    }
}
