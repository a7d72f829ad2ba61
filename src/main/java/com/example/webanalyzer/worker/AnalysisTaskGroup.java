package com.example.webanalyzer.worker;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;

/**
 * Группа связанных задач анализа, выполняемых параллельно на общем {@link WorkerPool}.
 *
 * Группа создаётся на один запрос. {@link #executeAll()} возвращается только после того,
 * как каждая задача отработала (успешно или с ошибкой); ошибки фиксируются по имени задачи
 * и не мешают остальным.
 */
@Slf4j
public class AnalysisTaskGroup {

    private final WorkerPool pool;
    private final List<AnalysisTask<?>> tasks = new ArrayList<>();
    private boolean executed;

    public AnalysisTaskGroup(WorkerPool pool) {
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    /**
     * Добавляет задачу в группу.
     *
     * @param name уникальное в пределах группы имя
     * @param work вычисление
     * @return типизированная ссылка для чтения результата
     */
    public <T> TaskHandle<T> addTask(String name, Callable<T> work) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(work, "work");
        if (executed) {
            throw new IllegalStateException("task group already executed");
        }
        for (AnalysisTask<?> existing : tasks) {
            if (existing.getName().equals(name)) {
                throw new IllegalArgumentException("Duplicate task name: " + name);
            }
        }
        AnalysisTask<T> task = new AnalysisTask<>(name, work);
        tasks.add(task);
        return new TaskHandle<>(this, task);
    }

    /**
     * Запускает все задачи параллельно и ждёт завершения каждой из них.
     */
    public void executeAll() throws InterruptedException {
        if (executed) {
            throw new IllegalStateException("task group already executed");
        }
        executed = true;

        CountDownLatch latch = new CountDownLatch(tasks.size());
        for (AnalysisTask<?> task : tasks) {
            boolean accepted = pool.submit(() -> {
                try {
                    task.run();
                } finally {
                    latch.countDown();
                }
            });
            if (!accepted) {
                task.fail(new RejectedExecutionException("worker pool is shut down"));
                latch.countDown();
            }
        }
        latch.await();
    }

    /**
     * Результат задачи по типизированной ссылке.
     *
     * @throws IllegalArgumentException если ссылка выдана другой группой
     * @throws IllegalStateException если задача ещё не выполнена
     */
    public <T> TaskOutcome<T> getResult(TaskHandle<T> handle) {
        if (handle.getOwner() != this) {
            throw new IllegalArgumentException("Handle belongs to another task group: " + handle.getName());
        }
        TaskOutcome<T> outcome = handle.getTask().getOutcome();
        if (outcome == null) {
            throw new IllegalStateException("Task '" + handle.getName() + "' has not completed");
        }
        return outcome;
    }

    /**
     * Результат задачи по имени. Для неизвестного имени возвращается пустой Optional
     * (отсутствие результата, а не ошибка).
     */
    public Optional<TaskOutcome<?>> getResult(String name) {
        for (AnalysisTask<?> task : tasks) {
            if (task.getName().equals(name)) {
                return Optional.ofNullable(task.getOutcome());
            }
        }
        return Optional.empty();
    }

    public boolean hasErrors() {
        return tasks.stream().anyMatch(task -> task.getOutcome() != null && !task.getOutcome().isSuccess());
    }

    /**
     * Ошибки задач в порядке добавления: имя задачи → ошибка.
     */
    public Map<String, Throwable> errors() {
        Map<String, Throwable> errors = new LinkedHashMap<>();
        for (AnalysisTask<?> task : tasks) {
            TaskOutcome<?> outcome = task.getOutcome();
            if (outcome != null && !outcome.isSuccess()) {
                errors.put(task.getName(), outcome.getError());
            }
        }
        return Collections.unmodifiableMap(errors);
    }

    public int size() {
        return tasks.size();
    }

    static final class AnalysisTask<T> {
        private final String name;
        private final Callable<T> work;
        private volatile TaskOutcome<T> outcome;

        AnalysisTask(String name, Callable<T> work) {
            this.name = name;
            this.work = work;
        }

        String getName() {
            return name;
        }

        TaskOutcome<T> getOutcome() {
            return outcome;
        }

        void run() {
            try {
                outcome = TaskOutcome.success(work.call());
            } catch (VirtualMachineError e) {
                outcome = TaskOutcome.failure(e);
                throw e;
            } catch (Throwable t) {
                outcome = TaskOutcome.failure(t);
                log.warn("Analysis task '{}' failed: {}", name, t.toString());
            }
        }

        void fail(Throwable error) {
            outcome = TaskOutcome.failure(error);
            log.warn("Analysis task '{}' was not scheduled: {}", name, error.getMessage());
        }
    }
}
