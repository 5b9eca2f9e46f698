package eu.virtualparadox.knowledgebase.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Pool on which the vector and lexical legs of a search run side by side.
 */
public class QueryExecutor extends ThreadPoolTaskExecutor {
}
