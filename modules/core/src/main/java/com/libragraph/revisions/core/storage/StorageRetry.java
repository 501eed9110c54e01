package com.libragraph.revisions.core.storage;

import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded exponential-backoff retry for transient storage failures.
 *
 * <p>Only {@link StorageException} is retried. Not-found and already-exists outcomes
 * are answers, not failures, and pass straight through. When the budget is spent the
 * last {@code StorageException} is rethrown as-is.
 */
@ApplicationScoped
public class StorageRetry {

    private static final Logger log = Logger.getLogger(StorageRetry.class);

    @ConfigProperty(name = "revisions.storage.retry.max-attempts", defaultValue = "3")
    int maxAttempts;

    @ConfigProperty(name = "revisions.storage.retry.initial-backoff", defaultValue = "100ms")
    Duration initialBackoff;

    @ConfigProperty(name = "revisions.storage.retry.max-backoff", defaultValue = "2s")
    Duration maxBackoff;

    public StorageRetry() {
    }

    public StorageRetry(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
    }

    /** Subscribes to {@code operation}, resubscribing on storage failures. */
    public <T> T await(Uni<T> operation, String what) {
        Uni<T> attempt = operation.onFailure(StorageException.class)
                .invoke(e -> log.debugf("Storage failure during %s: %s", what, e.getMessage()));
        if (maxAttempts > 1) {
            attempt = attempt.onFailure(StorageException.class)
                    .retry()
                    .withBackOff(initialBackoff, maxBackoff)
                    .atMost(maxAttempts - 1);
        }
        try {
            return attempt.await().indefinitely();
        } catch (RuntimeException e) {
            StorageException storage = findStorageFailure(e);
            if (storage != null && storage != e) {
                log.warnf("Giving up on %s after %d attempts: %s", what, maxAttempts, storage.getMessage());
                throw storage;
            }
            throw e;
        }
    }

    /** Runs a blocking call under the same retry policy. */
    public <T> T call(Supplier<T> operation, String what) {
        return await(Uni.createFrom().item(operation), what);
    }

    public void run(Runnable operation, String what) {
        await(Uni.createFrom().voidItem().invoke(operation), what);
    }

    // Exhausted backoff retries surface wrapped in an IllegalStateException
    private static StorageException findStorageFailure(Throwable t) {
        for (Throwable cur = t; cur != null; cur = cur.getCause()) {
            if (cur instanceof StorageException storage) {
                return storage;
            }
        }
        return null;
    }
}
