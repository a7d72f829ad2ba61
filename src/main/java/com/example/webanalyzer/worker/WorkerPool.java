package com.example.webanalyzer.worker;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Фиксированный пул рабочих потоков с общей ограниченной очередью задач.
 *
 * Если очередь заполнена, {@link #submit(WorkerTask)} блокирует вызывающий поток,
 * пока не освободится место. После начала остановки новые задачи отбрасываются.
 */
@Slf4j
public class WorkerPool {

    private static final long TERMINATION_POLL_SECONDS = 30;

    private final int workers;
    private final BlockingQueue<Runnable> queue;
    private final ThreadPoolExecutor executor;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public WorkerPool(int workers, int queueCapacity) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive");
        }
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive");
        }
        this.workers = workers;
        this.queue = new ArrayBlockingQueue<>(queueCapacity);

        AtomicInteger index = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("analysis-worker-" + index.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                workers, workers,
                0L, TimeUnit.MILLISECONDS,
                queue,
                factory,
                (runnable, pool) -> enqueueBlocking(runnable)
        );
        this.executor.prestartAllCoreThreads();
        log.info("Worker pool started: {} workers, queue capacity {}", workers, queueCapacity);
    }

    /**
     * Ставит задачу в очередь.
     *
     * @param task задача
     * @return {@code false}, если пул уже останавливается и задача отброшена
     */
    public boolean submit(WorkerTask task) {
        Objects.requireNonNull(task, "task");
        if (shuttingDown.get()) {
            log.warn("Worker pool is shutting down, task dropped");
            return false;
        }
        try {
            executor.execute(() -> runLogged(task));
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Worker pool rejected task: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Ставит задачу в очередь и ждёт её завершения.
     *
     * @param task задача
     * @throws ExecutionException если задача завершилась ошибкой (причина в {@code getCause()})
     * @throws RejectedExecutionException если пул уже останавливается
     */
    public void submitAndWait(WorkerTask task) throws InterruptedException, ExecutionException {
        Objects.requireNonNull(task, "task");
        CompletableFuture<Void> done = new CompletableFuture<>();

        boolean accepted = submit(() -> {
            try {
                task.run();
                done.complete(null);
            } catch (Throwable t) {
                done.completeExceptionally(t);
                throw t;
            }
        });

        if (!accepted) {
            throw new RejectedExecutionException("worker pool is shut down");
        }
        done.get();
    }

    /**
     * Прекращает приём задач, дожидается выполнения уже поставленных и останавливает потоки.
     * Повторный вызов ничего не делает.
     */
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down worker pool ({} queued tasks)", queue.size());
        executor.shutdown();
        try {
            while (!executor.awaitTermination(TERMINATION_POLL_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Worker pool still draining: {} active, {} queued",
                        executor.getActiveCount(), queue.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining worker pool, forcing shutdown");
            executor.shutdownNow();
        }
        log.info("Worker pool stopped");
    }

    public int getWorkers() {
        return workers;
    }

    public boolean isShutdown() {
        return shuttingDown.get();
    }

    private void enqueueBlocking(Runnable runnable) {
        if (executor.isShutdown()) {
            throw new RejectedExecutionException("worker pool is shut down");
        }
        try {
            queue.put(runnable);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RejectedExecutionException("Interrupted while enqueueing", e);
        }
        // пул мог остановиться, пока мы ждали места в очереди
        if (executor.isTerminated() && queue.remove(runnable)) {
            throw new RejectedExecutionException("worker pool is shut down");
        }
    }

    private void runLogged(WorkerTask task) {
        try {
            task.run();
        } catch (Exception e) {
            log.warn("Worker task failed: {}", e.getMessage(), e);
        }
    }
}
