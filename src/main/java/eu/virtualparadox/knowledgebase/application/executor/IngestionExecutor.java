package eu.virtualparadox.knowledgebase.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool running ingestion jobs. Distinct documents ingest in parallel up to its size.
 */
public class IngestionExecutor extends ThreadPoolTaskExecutor {
}
