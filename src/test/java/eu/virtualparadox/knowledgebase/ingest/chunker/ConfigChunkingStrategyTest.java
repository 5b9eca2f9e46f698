package eu.virtualparadox.knowledgebase.ingest.chunker;

import eu.virtualparadox.knowledgebase.ingest.model.ChunkDraft;
import eu.virtualparadox.knowledgebase.ingest.model.ChunkMetadata;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigChunkingStrategyTest {

    private final ConfigChunkingStrategy strategy = new ConfigChunkingStrategy();

    @Test
    void testYamlSplitsAtTopLevelKeysWithComments() {
        final String yaml = "server:\n  port: 8080\n# database settings\ndatabase:\n  url: jdbc\n";
        final List<ChunkDraft> drafts = strategy.chunk(TextRegion.whole(yaml, "app.yaml"), new ChunkingProfile(0, 8, 0));

        assertThat(drafts).hasSize(2);
        assertThat(drafts.get(0).text()).isEqualTo("server:\n  port: 8080\n");
        assertThat(drafts.get(1).text()).startsWith("# database settings");
        assertThat(drafts.get(0).metadata()).containsEntry(ChunkMetadata.CONFIG_KEYS, List.of("server"));
        assertThat(drafts.get(1).metadata()).containsEntry(ChunkMetadata.CONFIG_KEYS, List.of("database"));
        assertThat(drafts).allSatisfy(d -> assertThat(d.metadata()).containsEntry(ChunkMetadata.CONFIG_FORMAT, "yaml"));
    }

    @Test
    void testSmallConfigIsPackedTogether() {
        final String props = "a=1\nb=2\nc=3\n";
        final List<ChunkDraft> drafts = strategy.chunk(TextRegion.whole(props, null), new ChunkingProfile(0, 100, 0));

        assertThat(drafts).hasSize(1);
        assertThat(drafts.get(0).metadata())
                .containsEntry(ChunkMetadata.CONFIG_FORMAT, "properties")
                .containsEntry(ChunkMetadata.CONFIG_KEYS, List.of("a", "b", "c"));
    }

    @Test
    void testJsonSplitsAtTopLevelMembers() {
        final String json = "{\n  \"a\": 1,\n  \"b\": {\"c\": 2}\n}";
        final List<ChunkDraft> drafts = strategy.chunk(TextRegion.whole(json, null), new ChunkingProfile(0, 12, 0));

        assertThat(drafts).hasSize(2);
        assertThat(drafts.get(0).metadata()).containsEntry(ChunkMetadata.CONFIG_KEYS, List.of("a"));
        assertThat(drafts.get(1).metadata()).containsEntry(ChunkMetadata.CONFIG_KEYS, List.of("b"));
        assertThat(drafts.get(1).endOffset()).isEqualTo(json.length());
        assertThat(drafts.get(0).metadata()).containsEntry(ChunkMetadata.CONFIG_FORMAT, "json");
    }

    @Test
    void testMalformedJsonIsRejected() {
        final TextRegion region = TextRegion.whole("{\"a\": 1", null);
        final ChunkingProfile profile = new ChunkingProfile(0, 12, 0);

        assertThatThrownBy(() -> strategy.chunk(region, profile)).isInstanceOf(IllegalArgumentException.class);
    }
}
