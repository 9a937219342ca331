package com.nevis.curation.infra;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class InMemoryDualRateLimiterTest {

    private InMemoryDualRateLimiter limiter;
    private static final int RPM_LIMIT = 3;
    private static final int TPM_LIMIT = 100;

    @BeforeEach
    void setUp() {
        limiter = new InMemoryDualRateLimiter(RPM_LIMIT, TPM_LIMIT);
    }

    @Test
    void shouldEnforceRpmLimit() {
        String key = "embedding-rpm";
        AtomicInteger counter = new AtomicInteger(0);

        for (int i = 0; i < RPM_LIMIT; i++) {
            limiter.execute(key, 1, counter::incrementAndGet);
        }
        assertThat(counter.get()).isEqualTo(RPM_LIMIT);

        CompletableFuture<Integer> blockedTask = CompletableFuture.supplyAsync(() ->
            limiter.execute(key, 1, counter::incrementAndGet));

        assertThrows(TimeoutException.class, () -> blockedTask.get(200, TimeUnit.MILLISECONDS));
        assertThat(counter.get()).isEqualTo(RPM_LIMIT);
    }

    @Test
    void shouldEnforceTpmLimit() {
        String key = "embedding-tpm";

        limiter.execute(key, TPM_LIMIT, () -> "full");

        CompletableFuture<String> blockedTask = CompletableFuture.supplyAsync(() ->
            limiter.execute(key, 1, () -> "denied"));

        assertThrows(TimeoutException.class, () -> blockedTask.get(200, TimeUnit.MILLISECONDS));
    }

    @Test
    void shouldCapOversizedTokenRequestsAtTheBudget() throws Exception {
        CompletableFuture<String> task = CompletableFuture.supplyAsync(() ->
            limiter.execute("oversized", TPM_LIMIT * 10, () -> "done"));

        assertThat(task.get(1, TimeUnit.SECONDS)).isEqualTo("done");
    }

    @Test
    void shouldIsolateLimitsByKey() {
        for (int i = 0; i < RPM_LIMIT; i++) {
            limiter.acquire("key-a", 1);
        }

        CompletableFuture<String> independentTask = CompletableFuture.supplyAsync(() ->
            limiter.execute("key-b", 1, () -> "success"));

        assertThat(independentTask.join()).isEqualTo("success");
    }

    @Test
    void shouldRejectNonPositiveLimits() {
        assertThatThrownBy(() -> new InMemoryDualRateLimiter(0, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InMemoryDualRateLimiter(10, -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
