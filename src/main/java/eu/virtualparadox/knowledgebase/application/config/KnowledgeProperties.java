package eu.virtualparadox.knowledgebase.application.config;

import eu.virtualparadox.knowledgebase.ingest.chunker.ChunkingProfile;
import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Tunables of the retrieval core, bound from {@code knowledge.*}.
 * Every default below is the documented behaviour when the key is absent.
 */
@Configuration
@ConfigurationProperties(prefix = "knowledge")
@Getter @Setter
public class KnowledgeProperties {

    private Classifier classifier = new Classifier();
    private Chunking chunking = new Chunking();
    private Embedding embedding = new Embedding();
    private Retrieval retrieval = new Retrieval();
    private Rerank rerank = new Rerank();
    private Ingestion ingestion = new Ingestion();

    @Getter @Setter
    public static class Classifier {
        /** {@code heuristic} or {@code llm}. */
        private String provider = "heuristic";
        /** Number of leading characters inspected. */
        private int sampleChars = 4000;
        private Duration retryBackoff = Duration.ofMillis(500);
    }

    @Getter @Setter
    public static class Chunking {
        private Map<DocumentClass, ChunkingProfile> profiles = defaultProfiles();
        /** Window used by the generic fallback strategy. */
        private ChunkingProfile fallback = new ChunkingProfile(256, 512, 32);

        public ChunkingProfile profileFor(final DocumentClass documentClass) {
            return profiles.getOrDefault(documentClass, fallback);
        }

        private static Map<DocumentClass, ChunkingProfile> defaultProfiles() {
            final Map<DocumentClass, ChunkingProfile> profiles = new EnumMap<>(DocumentClass.class);
            profiles.put(DocumentClass.TEXT, new ChunkingProfile(512, 1024, 64));
            profiles.put(DocumentClass.MARKDOWN, new ChunkingProfile(512, 1024, 64));
            // overlap counted in rows
            profiles.put(DocumentClass.TABLE, new ChunkingProfile(256, 512, 1));
            profiles.put(DocumentClass.CONFIG, new ChunkingProfile(256, 512, 0));
            // overlap counted in lines
            profiles.put(DocumentClass.LOG, new ChunkingProfile(64, 256, 2));
            profiles.put(DocumentClass.CODE, new ChunkingProfile(32, 1024, 64));
            profiles.put(DocumentClass.MIXED, new ChunkingProfile(256, 512, 32));
            return profiles;
        }
    }

    @Getter @Setter
    public static class Embedding {
        /** {@code onnx}, {@code remote} or {@code hashing}. */
        private String provider = "onnx";
        private int dimensions = 384;
        private int batchSize = 16;
        private int maxConcurrency = 4;
        private Duration retryBackoff = Duration.ofMillis(500);
        private int onnxThreads = 0;
    }

    @Getter @Setter
    public static class Retrieval {
        private int defaultTopK = 5;
        private int maxTopK = 100;
        /** Candidate pool per search list is {@code topK * candidateMultiplier}. */
        private int candidateMultiplier = 3;
        private int rrfK = 60;
        /** Candidates handed to the reranker are {@code topK * rerankFanOut}. */
        private int rerankFanOut = 3;
        private Duration queryTimeout = Duration.ofSeconds(10);
    }

    @Getter @Setter
    public static class Rerank {
        /** {@code none} or {@code onnx}. */
        private String provider = "none";
        /** Whether requests that do not say otherwise are reranked. */
        private boolean enabledByDefault = true;
    }

    @Getter @Setter
    public static class Ingestion {
        private int workers = 2;
        private int queueCapacity = 1000;
        private int queryThreads = 4;
        /** Soft-deleted chunks older than this are purged by garbage collection. */
        private Duration retention = Duration.ofDays(7);
        /** Pause between garbage collection passes. */
        private Duration gcInterval = Duration.ofHours(1);
        private int maxContentChars = 5_000_000;
        private String defaultKnowledgeBase = "default";
    }
}
