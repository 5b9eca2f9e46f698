package eu.virtualparadox.knowledgebase.application.config;

import eu.virtualparadox.knowledgebase.application.executor.IngestionExecutor;
import eu.virtualparadox.knowledgebase.application.executor.QueryExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
public class ExecutorConfig {

    @Bean
    public IngestionExecutor ingestionExecutor(final KnowledgeProperties properties) {
        final int workers = Math.max(1, properties.getIngestion().getWorkers());
        final IngestionExecutor executor = new IngestionExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(properties.getIngestion().getQueueCapacity());
        executor.setThreadNamePrefix("ingest-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean
    public QueryExecutor queryExecutor(final KnowledgeProperties properties) {
        final int threads = Math.max(2, properties.getIngestion().getQueryThreads());
        final QueryExecutor executor = new QueryExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("query-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(5);
        executor.initialize();
        return executor;
    }
}
