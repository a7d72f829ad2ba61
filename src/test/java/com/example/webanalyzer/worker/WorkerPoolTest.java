package com.example.webanalyzer.worker;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPoolTest {

    private WorkerPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown();
        }
    }

    @Test
    void shouldRunTaskAndWaitForIt() throws Exception {
        pool = new WorkerPool(2, 4);
        AtomicInteger counter = new AtomicInteger();

        pool.submitAndWait(counter::incrementAndGet);

        assertEquals(1, counter.get());
    }

    @Test
    void shouldReportTaskErrorFromSubmitAndWait() {
        pool = new WorkerPool(2, 4);

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> pool.submitAndWait(() -> {
                    throw new IllegalStateException("boom");
                }));

        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals("boom", error.getCause().getMessage());
    }

    @Test
    void shouldKeepWorkingAfterTaskFailure() throws Exception {
        pool = new WorkerPool(1, 2);
        AtomicInteger counter = new AtomicInteger();

        assertTrue(pool.submit(() -> {
            throw new IllegalStateException("boom");
        }));
        pool.submitAndWait(counter::incrementAndGet);

        assertEquals(1, counter.get());
    }

    @Test
    void shouldRunTasksConcurrently() throws Exception {
        pool = new WorkerPool(3, 6);
        CyclicBarrier barrier = new CyclicBarrier(3);
        CountDownLatch done = new CountDownLatch(3);

        for (int i = 0; i < 3; i++) {
            pool.submit(() -> {
                barrier.await(5, TimeUnit.SECONDS);
                done.countDown();
            });
        }

        assertTrue(done.await(5, TimeUnit.SECONDS), "all three tasks should meet at the barrier");
    }

    @Test
    void shouldBlockSubmitWhileQueueIsFull() throws Exception {
        pool = new WorkerPool(1, 1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);

        pool.submit(() -> {
            started.countDown();
            release.await();
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));
        pool.submit(() -> { });

        Thread submitter = new Thread(() -> pool.submit(() -> { }));
        submitter.start();
        submitter.join(300);
        assertTrue(submitter.isAlive(), "submit should wait for free queue space");

        release.countDown();
        submitter.join(5000);
        assertFalse(submitter.isAlive());
    }

    @Test
    void shouldDrainQueuedTasksOnShutdown() {
        pool = new WorkerPool(1, 10);
        AtomicInteger counter = new AtomicInteger();

        for (int i = 0; i < 5; i++) {
            pool.submit(() -> {
                Thread.sleep(20);
                counter.incrementAndGet();
            });
        }
        pool.shutdown();

        assertEquals(5, counter.get());
        assertTrue(pool.isShutdown());
    }

    @Test
    void shouldDropTasksAfterShutdown() {
        pool = new WorkerPool(1, 2);
        pool.shutdown();
        pool.shutdown();

        assertFalse(pool.submit(() -> { }));
        RejectedExecutionException error = assertThrows(RejectedExecutionException.class,
                () -> pool.submitAndWait(() -> { }));
        assertEquals("worker pool is shut down", error.getMessage());
    }

    @Test
    void shouldRejectInvalidSizes() {
        assertThrows(IllegalArgumentException.class, () -> new WorkerPool(0, 1));
        assertThrows(IllegalArgumentException.class, () -> new WorkerPool(1, 0));
    }
}
