package com.nevis.curation.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import lombok.SneakyThrows;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Enforces both a requests-per-minute and a tokens-per-minute budget per key. A call consumes one request and
 * the estimated number of tokens, waiting for whichever budget refills last.
 */
public class InMemoryDualRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> requestBuckets = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Bucket> tokenBuckets = new ConcurrentHashMap<>();

    private final int requestsPerMinute;
    private final int tokensPerMinute;

    public InMemoryDualRateLimiter(int requestsPerMinute, int tokensPerMinute) {
        if (requestsPerMinute <= 0 || tokensPerMinute <= 0) {
            throw new IllegalArgumentException("Rate limits must be positive");
        }
        this.requestsPerMinute = requestsPerMinute;
        this.tokensPerMinute = tokensPerMinute;
    }

    private static Bucket perMinute(int capacity) {
        return Bucket.builder()
            .addLimit(Bandwidth.builder().capacity(capacity).refillGreedy(capacity, Duration.ofMinutes(1)).build())
            .build();
    }

    @Override
    @SneakyThrows
    public void acquire(String key, int tokens) {
        Bucket requests = requestBuckets.computeIfAbsent(key, k -> perMinute(requestsPerMinute));
        Bucket budget = tokenBuckets.computeIfAbsent(key, k -> perMinute(tokensPerMinute));

        requests.asBlocking().consume(1);
        budget.asBlocking().consume(Math.min(Math.max(tokens, 1), tokensPerMinute));
    }
}
