package com.nevis.curation.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import lombok.SneakyThrows;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps a minimum delay between consecutive calls for the same key, regardless of the permits requested.
 */
public class IntervalRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();
    private final Duration minInterval;

    public IntervalRateLimiter(Duration minInterval) {
        if (minInterval == null || minInterval.isNegative() || minInterval.isZero()) {
            throw new IllegalArgumentException("Minimum interval must be positive: " + minInterval);
        }
        this.minInterval = minInterval;
    }

    @Override
    @SneakyThrows
    public void acquire(String key, int permits) {
        Bucket bucket = buckets.computeIfAbsent(key, k -> Bucket.builder()
            .addLimit(Bandwidth.builder().capacity(1).refillIntervally(1, minInterval).build())
            .build());
        bucket.asBlocking().consume(1);
    }

    public Duration minInterval() {
        return minInterval;
    }
}
