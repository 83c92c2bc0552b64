package com.creditintel.backend.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class IssuerLocksTest {

    private final IssuerLocks locks = new IssuerLocks();

    @Test
    void lockIsDroppedOnceReleased() {
        for (int i = 0; i < 100; i++) {
            String issuerId = "ISSUER" + i;
            locks.withLock(issuerId, () -> {
                assertThat(locks.isHeldByCurrentThread(issuerId)).isTrue();
                return null;
            });
        }

        assertThat(locks.activeIssuers()).isZero();
        assertThat(locks.isHeldByCurrentThread("ISSUER0")).isFalse();
    }

    @Test
    void reentrantUseKeepsTheLockUntilTheOuterCallReturns() {
        locks.withLock("AAPL", () -> locks.withLock("AAPL", () -> {
            assertThat(locks.activeIssuers()).isEqualTo(1);
            return null;
        }));

        assertThat(locks.activeIssuers()).isZero();
    }

    @Test
    void waitersShareTheLockOfTheHolder() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            Future<?> holder = executor.submit(() -> locks.withLock("AAPL", () -> {
                maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                holding.countDown();
                awaitQuietly(release);
                inside.decrementAndGet();
                return null;
            }));
            assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();
            Future<?> first = executor.submit(() -> locks.withLock("AAPL", () -> {
                maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                inside.decrementAndGet();
                return null;
            }));
            Future<?> second = executor.submit(() -> locks.withLock("AAPL", () -> {
                maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                inside.decrementAndGet();
                return null;
            }));

            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
            first.get(5, TimeUnit.SECONDS);
            second.get(5, TimeUnit.SECONDS);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(locks.activeIssuers()).isZero();
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
