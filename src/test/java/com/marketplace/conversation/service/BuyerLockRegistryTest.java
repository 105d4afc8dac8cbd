package com.marketplace.conversation.service;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class BuyerLockRegistryTest {

    private final BuyerLockRegistry registry = new BuyerLockRegistry();

    @Test
    void lockIsReleasedAndForgottenAfterUse() {
        assertThat(registry.withLock("B-1", () -> registry.trackedBuyers())).isEqualTo(1);

        assertThat(registry.trackedBuyers()).isZero();
    }

    @Test
    void lockIsForgottenEvenWhenWorkFails() {
        try {
            registry.withLock("B-1", () -> {
                throw new IllegalStateException("boom");
            });
        } catch (IllegalStateException expected) {
            assertThat(expected).hasMessage("boom");
        }

        assertThat(registry.trackedBuyers()).isZero();
    }

    @Test
    void nestedUseBySameThread_isReentrant() {
        String result = registry.withLock("B-1", () -> registry.withLock("B-1", () -> "inner"));

        assertThat(result).isEqualTo("inner");
        assertThat(registry.trackedBuyers()).isZero();
    }

    @Test
    void sameBuyerWorkNeverOverlaps() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return registry.withLock("B-1", () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        inside.decrementAndGet();
                        return null;
                    });
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(registry.trackedBuyers()).isZero();
    }
}
