package com.potatoregistry.upload;

import com.potatoregistry.config.RegistryProperties;
import com.potatoregistry.error.TransientStorageException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Bounded retry of {@link TransientStorageException}s with capped exponential backoff plus jitter.
 * Every other exception passes through on the first attempt.
 */
@Slf4j
public final class RetryPolicy {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxAttempts;
    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, Sleeper sleeper) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.maxAttempts = maxAttempts;
        this.initialBackoffMs = Math.max(0, initialBackoff.toMillis());
        this.maxBackoffMs = Math.max(initialBackoffMs, maxBackoff.toMillis());
        this.sleeper = sleeper;
    }

    public static RetryPolicy from(RegistryProperties.Retry cfg) {
        return new RetryPolicy(cfg.maxAttempts(), cfg.initialBackoff(), cfg.maxBackoff(), Thread::sleep);
    }

    public <T> T call(String what, Supplier<T> op) {
        for (int attempt = 1; ; attempt++) {
            try {
                return op.get();
            } catch (TransientStorageException e) {
                if (attempt >= maxAttempts) {
                    log.warn("{} failed after {} attempt(s): {}", what, attempt, e.getMessage());
                    throw e;
                }
                long delay = backoff(attempt);
                log.warn("{} failed (attempt {}/{}), retrying in {} ms: {}", what, attempt, maxAttempts, delay, e.getMessage());
                pause(delay, e);
            }
        }
    }

    long backoff(int attempt) {
        long base = Math.min(initialBackoffMs << Math.min(attempt - 1, 20), maxBackoffMs);
        long jitter = base == 0 ? 0 : ThreadLocalRandom.current().nextLong(0, base / 2 + 1);
        return Math.min(base + jitter, maxBackoffMs);
    }

    private void pause(long delay, TransientStorageException cause) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            cause.addSuppressed(ie);
            throw cause;
        }
    }
}
