package com.example.webanalyzer.worker;

/**
 * Единица работы для {@link WorkerPool}. Ошибка сообщается через исключение.
 */
@FunctionalInterface
public interface WorkerTask {
    void run() throws Exception;
}
