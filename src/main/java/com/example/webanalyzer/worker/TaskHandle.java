package com.example.webanalyzer.worker;

/**
 * Типизированная ссылка на задачу внутри {@link AnalysisTaskGroup}.
 *
 * @param <T> тип результата задачи
 */
public final class TaskHandle<T> {

    private final AnalysisTaskGroup owner;
    private final AnalysisTaskGroup.AnalysisTask<T> task;

    TaskHandle(AnalysisTaskGroup owner, AnalysisTaskGroup.AnalysisTask<T> task) {
        this.owner = owner;
        this.task = task;
    }

    public String getName() {
        return task.getName();
    }

    AnalysisTaskGroup getOwner() {
        return owner;
    }

    AnalysisTaskGroup.AnalysisTask<T> getTask() {
        return task;
    }

    @Override
    public String toString() {
        return "TaskHandle[" + task.getName() + "]";
    }
}
