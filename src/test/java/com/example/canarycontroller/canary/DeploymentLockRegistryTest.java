package com.example.canarycontroller.canary;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DeploymentLockRegistryTest {

    private final DeploymentLockRegistry locks = new DeploymentLockRegistry();

    @Test
    void lockIsReleasedAfterWork() {
        assertEquals("done", locks.withLock("d-1", () -> {
            assertEquals(1, locks.size());
            return "done";
        }));

        assertEquals(0, locks.size());
    }

    @Test
    void lockIsReleasedWhenWorkThrows() {
        assertThrows(IllegalStateException.class, () -> locks.withLock("d-1", () -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals(0, locks.size());
    }

    @Test
    void sameThreadMayReenter() {
        int result = locks.withLock("d-1", () -> locks.withLock("d-1", () -> {
            assertEquals(1, locks.size());
            return 7;
        }));

        assertEquals(7, result);
        assertEquals(0, locks.size());
    }

    @Test
    void sameDeploymentRunsOneAtATime() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch go = new CountDownLatch(1);
        try {
            Future<?>[] futures = new Future<?>[8];
            for (int i = 0; i < futures.length; i++) {
                futures[i] = pool.submit(() -> {
                    go.await();
                    return locks.withLock("d-1", () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        Thread.onSpinWait();
                        inside.decrementAndGet();
                        return null;
                    });
                });
            }
            go.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, maxInside.get());
        assertEquals(0, locks.size());
    }
}
