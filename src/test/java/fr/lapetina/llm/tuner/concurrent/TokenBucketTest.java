package fr.lapetina.llm.tuner.concurrent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class TokenBucketTest {

    @Test
    @DisplayName("should space reserved slots by the interval on a frozen clock")
    void shouldSpaceSlots() {
        AtomicLong clock = new AtomicLong(10_000);
        TokenBucket bucket = new TokenBucket(10, 20, clock::get);

        assertThat(bucket.reserve()).isEqualTo(100);
        assertThat(bucket.reserve()).isEqualTo(200);
        assertThat(bucket.reserve()).isEqualTo(300);
    }

    @Test
    @DisplayName("should not accumulate credit while idle")
    void shouldNotAccumulateCredit() {
        AtomicLong clock = new AtomicLong(10_000);
        TokenBucket bucket = new TokenBucket(10, 20, clock::get);

        bucket.reserve();
        clock.addAndGet(5_000);

        assertThat(bucket.reserve()).isEqualTo(100);
        assertThat(bucket.reserve()).isEqualTo(200);
    }

    @Test
    @DisplayName("should hand out distinct slots under concurrent reservation")
    void shouldHandOutDistinctSlots() throws Exception {
        AtomicLong clock = new AtomicLong(0);
        TokenBucket bucket = new TokenBucket(100, 200, clock::get);
        int threads = 8;
        int perThread = 50;
        ConcurrentLinkedQueue<Long> waits = new ConcurrentLinkedQueue<>();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        try {
            for (int t = 0; t < threads; t++) {
                executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        waits.add(bucket.reserve());
                    }
                    return null;
                });
            }
            start.countDown();
            executor.shutdown();
            assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdownNow();
        }

        // Frozen clock: every wait is a distinct multiple of the 10 ms interval
        assertThat(waits).hasSize(threads * perThread).doesNotHaveDuplicates();
        assertThat(waits).allMatch(wait -> wait % 10 == 0);
        assertThat(waits.stream().mapToLong(Long::longValue).max().orElse(0))
                .isEqualTo(10L * threads * perThread);
    }

    @Test
    @DisplayName("should grant slots at least 1000/rps ms apart in real time")
    void shouldGrantSlotsApartInRealTime() {
        TokenBucket bucket = new TokenBucket(20, 40);
        List<CompletableFuture<Long>> grants = new ArrayList<>();

        for (int i = 0; i < 5; i++) {
            grants.add(bucket.acquire().thenApply(ignored -> System.currentTimeMillis()));
        }
        List<Long> times = grants.stream().map(CompletableFuture::join).sorted().toList();

        // 50 ms interval over four gaps, small tolerance for timer rounding
        assertThat(times.get(times.size() - 1) - times.get(0)).isGreaterThanOrEqualTo(190);
    }
}
