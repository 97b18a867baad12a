package uk.gegc.livequiz.shared.ratelimit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryRateLimitStoreTest {

    private static final Duration WINDOW = Duration.ofSeconds(60);
    private static final Instant START = Instant.parse("2024-01-01T12:00:00Z");

    private final InMemoryRateLimitStore store = new InMemoryRateLimitStore();

    @Test
    @DisplayName("admits up to the limit and then rejects until the window resets")
    void limitWithinWindow() {
        for (int i = 0; i < 3; i++) {
            assertThat(store.tryAcquire("submit:p1", 3, WINDOW, START).allowed()).isTrue();
        }

        RateLimitDecision rejected = store.tryAcquire("submit:p1", 3, WINDOW, START.plusSeconds(10));
        assertThat(rejected.allowed()).isFalse();
        assertThat(rejected.retryAfterSeconds()).isEqualTo(50);

        assertThat(store.tryAcquire("submit:p1", 3, WINDOW, START.plusSeconds(60)).allowed()).isTrue();
    }

    @Test
    @DisplayName("keys are counted independently")
    void keysAreIndependent() {
        store.tryAcquire("submit:p1", 1, WINDOW, START);

        assertThat(store.tryAcquire("submit:p1", 1, WINDOW, START).allowed()).isFalse();
        assertThat(store.tryAcquire("submit:p2", 1, WINDOW, START).allowed()).isTrue();
    }

    @Test
    @DisplayName("remaining counts down with each admitted request")
    void remainingCountsDown() {
        assertThat(store.tryAcquire("k", 3, WINDOW, START).remaining()).isEqualTo(2);
        assertThat(store.tryAcquire("k", 3, WINDOW, START).remaining()).isEqualTo(1);
        assertThat(store.tryAcquire("k", 3, WINDOW, START).remaining()).isZero();
    }

    @Test
    @DisplayName("sweep evicts only expired windows")
    void evictExpired() {
        store.tryAcquire("old", 5, WINDOW, START);
        store.tryAcquire("new", 5, WINDOW, START.plusSeconds(30));

        int evicted = store.evictExpired(START.plusSeconds(61));

        assertThat(evicted).isEqualTo(1);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("concurrent callers never exceed the limit")
    void concurrentAcquire_neverExceedsLimit() throws InterruptedException {
        int threads = 16;
        int limit = 5;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();

        for (int i = 0; i < threads * 4; i++) {
            executor.submit(() -> {
                start.await();
                if (store.tryAcquire("hot", limit, WINDOW, START).allowed()) {
                    admitted.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(admitted.get()).isEqualTo(limit);
    }
}
