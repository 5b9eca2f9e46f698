package eu.virtualparadox.knowledgebase.application.config;

import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClassifier;
import eu.virtualparadox.knowledgebase.ingest.classifier.HeuristicDocumentClassifier;
import eu.virtualparadox.knowledgebase.ingest.classifier.LlmDocumentClassifier;
import eu.virtualparadox.knowledgebase.rag.embed.EmbeddingService;
import eu.virtualparadox.knowledgebase.rag.embed.HashingEmbeddingService;
import eu.virtualparadox.knowledgebase.rag.embed.OnnxEmbeddingService;
import eu.virtualparadox.knowledgebase.rag.embed.RemoteEmbeddingService;
import eu.virtualparadox.knowledgebase.rag.embed.ResilientEmbeddingService;
import eu.virtualparadox.knowledgebase.rag.rerank.service.OnnxRerankService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Selects the classifier, embedder and reranker backends from {@code knowledge.*}.
 */
@Configuration
@Slf4j
public class PipelineConfig {

    @Bean
    public DocumentClassifier documentClassifier(final KnowledgeProperties properties,
                                                 final ObjectProvider<ChatModel> chatModel) {
        final HeuristicDocumentClassifier heuristic = new HeuristicDocumentClassifier();
        final String provider = properties.getClassifier().getProvider().toLowerCase(Locale.ROOT);
        if ("llm".equals(provider)) {
            final ChatModel model = chatModel.getIfAvailable();
            if (model == null) {
                throw new IllegalStateException("knowledge.classifier.provider=llm requires a configured chat model");
            }
            log.info("Using LLM document classifier with heuristic fallback");
            return new LlmDocumentClassifier(model, heuristic, properties.getClassifier().getRetryBackoff());
        }
        if (!"heuristic".equals(provider)) {
            throw new IllegalStateException("Unknown classifier provider: " + provider);
        }
        return heuristic;
    }

    /**
     * The configured backend wrapped with batching, the concurrency cap and retries.
     */
    @Bean
    public EmbeddingService embeddingService(final KnowledgeProperties properties,
                                             final StorageConfig storage,
                                             final ObjectProvider<EmbeddingModel> embeddingModel) {
        final KnowledgeProperties.Embedding settings = properties.getEmbedding();
        final String provider = settings.getProvider().toLowerCase(Locale.ROOT);
        final EmbeddingService backend = switch (provider) {
            case "hashing" -> new HashingEmbeddingService(settings.getDimensions());
            case "onnx" -> new OnnxEmbeddingService(storage.model("embedding"),
                    settings.getDimensions(), settings.getOnnxThreads());
            case "remote" -> {
                final EmbeddingModel model = embeddingModel.getIfAvailable();
                if (model == null) {
                    throw new IllegalStateException("knowledge.embedding.provider=remote requires a configured embedding model");
                }
                yield new RemoteEmbeddingService(model, settings.getDimensions());
            }
            default -> throw new IllegalStateException("Unknown embedding provider: " + provider);
        };
        log.info("Using {} embeddings with {} dimensions", provider, settings.getDimensions());
        return new ResilientEmbeddingService(backend, settings.getBatchSize(), settings.getMaxConcurrency(),
                settings.getRetryBackoff());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "knowledge.rerank", name = "provider", havingValue = "onnx")
    public OnnxRerankService rerankService(final StorageConfig storage, final KnowledgeProperties properties) {
        return new OnnxRerankService(storage.model("reranker"), properties.getEmbedding().getOnnxThreads());
    }
}
