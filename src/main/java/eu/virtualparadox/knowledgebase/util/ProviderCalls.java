package eu.virtualparadox.knowledgebase.util;

import eu.virtualparadox.knowledgebase.error.KnowledgeBaseException;
import eu.virtualparadox.knowledgebase.error.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.retry.NonTransientAiException;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs a provider call with a single retry after a bounded backoff.
 * <p>
 * Errors that are known to be permanent ({@link NonTransientAiException}, our own
 * {@link KnowledgeBaseException}s) are not retried.
 */
@Slf4j
public final class ProviderCalls {

    private ProviderCalls() {
        // prevent instantiation
    }

    public static <T> T withRetry(final String stage,
                                  final Duration backoff,
                                  final Supplier<T> call) {
        try {
            return call.get();
        } catch (final NonTransientAiException | KnowledgeBaseException e) {
            throw wrap(stage, e);
        } catch (final RuntimeException first) {
            log.warn("{} provider call failed, retrying once in {} ms: {}", stage, backoff.toMillis(), first.getMessage());
            sleep(stage, backoff, first);
            try {
                return call.get();
            } catch (final RuntimeException second) {
                if (second != first) {
                    second.addSuppressed(first);
                }
                throw wrap(stage, second);
            }
        }
    }

    private static RuntimeException wrap(final String stage, final RuntimeException e) {
        if (e instanceof KnowledgeBaseException) {
            return e;
        }
        return new ProviderException(stage, "provider call failed: " + e.getMessage(), e);
    }

    private static void sleep(final String stage, final Duration backoff, final RuntimeException cause) {
        if (backoff.isZero() || backoff.isNegative()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ProviderException(stage, "interrupted while backing off", cause);
        }
    }
}
