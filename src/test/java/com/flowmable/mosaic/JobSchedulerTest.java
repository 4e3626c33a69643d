package com.flowmable.mosaic;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class JobSchedulerTest {

    @Test
    void everySlotFilledAfterBarrier() {
        int n = 200;
        long[] slots = new long[n];
        try (JobScheduler scheduler = new JobScheduler(4)) {
            for (int i = 0; i < n; i++) {
                final int slot = i;
                scheduler.submit(() -> slots[slot] = (long) slot * slot);
            }
            assertEquals(0, scheduler.awaitAll());
        }
        for (int i = 0; i < n; i++) {
            assertEquals((long) i * i, slots[i]);
        }
    }

    @Test
    void awaitAll_withNothingPendingReturnsImmediately() {
        try (JobScheduler scheduler = new JobScheduler(1)) {
            assertEquals(0, scheduler.awaitAll());
            assertEquals(0, scheduler.newBatch().awaitAll());
        }
    }

    @Test
    void failingUnit_isCountedAndSiblingsComplete() {
        boolean[] done = new boolean[10];
        try (JobScheduler scheduler = new JobScheduler(3)) {
            for (int i = 0; i < 10; i++) {
                final int slot = i;
                scheduler.submit(() -> {
                    if (slot == 4) throw new IllegalStateException("boom");
                    done[slot] = true;
                });
            }
            assertEquals(1, scheduler.awaitAll());
        }
        for (int i = 0; i < 10; i++) {
            assertEquals(i != 4, done[i], "slot " + i);
        }
    }

    @Test
    void barrierIsReusable() {
        try (JobScheduler scheduler = new JobScheduler(2)) {
            scheduler.submit(() -> { throw new IllegalStateException("first"); });
            assertEquals(1, scheduler.awaitAll());

            scheduler.submit(() -> { });
            assertEquals(0, scheduler.awaitAll());
        }
    }

    @Test
    void batches_waitOnlyForTheirOwnUnits() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean slowFinished = new AtomicBoolean();
        AtomicBoolean fastFinished = new AtomicBoolean();

        try (JobScheduler scheduler = new JobScheduler(2)) {
            JobScheduler.Batch slow = scheduler.newBatch();
            JobScheduler.Batch fast = scheduler.newBatch();

            slow.submit(() -> {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                slowFinished.set(true);
            });
            fast.submit(() -> fastFinished.set(true));

            assertEquals(0, fast.awaitAll());
            assertTrue(fastFinished.get());
            assertFalse(slowFinished.get());

            release.countDown();
            assertEquals(0, slow.awaitAll());
            assertTrue(slowFinished.get());
        }
    }

    @Test
    void rejectsEmptyPool() {
        assertThrows(IllegalArgumentException.class, () -> new JobScheduler(0));
    }

    @Test
    void defaultSize_scalesWithProcessors() {
        try (JobScheduler scheduler = new JobScheduler()) {
            assertEquals(2 * Runtime.getRuntime().availableProcessors(), scheduler.workerCount());
        }
    }
}
