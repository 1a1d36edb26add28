package com.nevis.citation.infra;

import java.util.function.Supplier;

/**
 * Throttles calls to the analysis model provider. Keys separate independent quotas.
 */
public interface RateLimiter {

    void acquire(String key, int permits);

    default void release(String key, int permits) {
    }

    default <T> T execute(String key, int permits, Supplier<T> task) {
        acquire(key, permits);
        try {
            return task.get();
        } finally {
            release(key, permits);
        }
    }
}
