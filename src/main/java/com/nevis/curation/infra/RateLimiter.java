package com.nevis.curation.infra;

import java.util.function.Supplier;

/**
 * Throttles calls toward an external provider. {@code acquire} blocks until the call may proceed.
 */
public interface RateLimiter {

    void acquire(String key, int permits);

    default void release(String key, int permits) {
    }

    default <T> T execute(String key, int permits, Supplier<T> task) {
        try {
            acquire(key, permits);
            return task.get();
        } finally {
            release(key, permits);
        }
    }
}
