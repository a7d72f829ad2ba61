package com.example.webanalyzer.worker;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Результат выполнения задачи: либо значение, либо ошибка.
 *
 * @param <T> тип значения
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class TaskOutcome<T> {

    private final T value;
    private final Throwable error;

    public static <T> TaskOutcome<T> success(T value) {
        return new TaskOutcome<>(value, null);
    }

    public static <T> TaskOutcome<T> failure(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new TaskOutcome<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Значение при успехе, иначе {@code fallback}.
     */
    public T orElse(T fallback) {
        return isSuccess() ? value : fallback;
    }
}
