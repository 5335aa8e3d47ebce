package com.platform.healthmonitor.retry;

import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class RetryRegistryTest {

    @Test
    void secondAcquireFailsUntilReleased() {
        RetryRegistry registry = new RetryRegistry();

        assertThat(registry.tryAcquire("web-1")).isTrue();
        assertThat(registry.tryAcquire("web-1")).isFalse();
        assertThat(registry.isArmed("web-1")).isTrue();

        registry.release("web-1");

        assertThat(registry.isArmed("web-1")).isFalse();
        assertThat(registry.tryAcquire("web-1")).isTrue();
    }

    @Test
    void snapshotIsSortedCopy() {
        RetryRegistry registry = new RetryRegistry();
        registry.tryAcquire("worker-1");
        registry.tryAcquire("api-1");

        assertThat(registry.snapshot()).containsExactly("api-1", "worker-1");
        registry.release("api-1");
        assertThat(registry.size()).isEqualTo(1);
    }

    @RepeatedTest(20)
    void concurrentAcquiresGrantAtMostOneHolderPerId() throws Exception {
        RetryRegistry registry = new RetryRegistry();
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger holders = new AtomicInteger();
        AtomicInteger maxHolders = new AtomicInteger();
        long seed = System.nanoTime();

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                Random random = new Random(seed + t);
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 200; i++) {
                        if (registry.tryAcquire("db-1")) {
                            int now = holders.incrementAndGet();
                            maxHolders.accumulateAndGet(now, Math::max);
                            if (random.nextBoolean()) {
                                Thread.yield();
                            }
                            holders.decrementAndGet();
                            registry.release("db-1");
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxHolders.get()).as("seed %d", seed).isEqualTo(1);
        assertThat(registry.isArmed("db-1")).isFalse();
    }
}
