package com.example.webanalyzer.service.extraction;

import com.example.webanalyzer.model.WebpageAnalysis;

/**
 * Независимый проход извлечения одного поля результата.
 *
 * Каждый бин этого типа выполняется отдельной задачей пула. Проход только читает документ,
 * поэтому проходы можно запускать параллельно в любом порядке.
 *
 * @param <T> тип извлекаемого значения
 */
public interface ExtractionPass<T> {

    /**
     * Уникальное имя прохода, под которым фиксируются результат и ошибка.
     */
    String getName();

    T extract(PageContext context) throws Exception;

    /**
     * Переносит значение в собираемый результат.
     */
    void apply(T value, WebpageAnalysis.WebpageAnalysisBuilder builder);
}
