package com.example.webanalyzer.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Результат анализа веб-страницы. Неизменяем после сборки.
 */
@Value
@Builder(toBuilder = true)
public class WebpageAnalysis {

    public static final String DEFAULT_HTML_VERSION = "HTML5 (implied)";

    /**
     * Адрес анализируемой страницы (как в запросе)
     */
    String url;

    /**
     * Версия HTML, определённая по DOCTYPE
     */
    @Builder.Default
    String htmlVersion = "";

    /**
     * Заголовок страницы, пустая строка если отсутствует
     */
    @Builder.Default
    String pageTitle = "";

    /**
     * Количество заголовков по уровням (h1..h6); нулевые уровни не включаются
     */
    @Singular
    Map<String, Integer> headings;

    int internalLinks;
    int externalLinks;
    int inaccessibleLinks;

    /**
     * Найдена ли на странице форма входа
     */
    boolean loginForm;

    /**
     * Момент завершения анализа
     */
    Instant analyzedAt;

    /**
     * Длительность обработки запроса
     */
    Duration processingTime;

    /**
     * Ошибки отдельных проходов извлечения: имя прохода → сообщение
     */
    @Singular
    Map<String, String> extractionErrors;

    public boolean isComplete() {
        return extractionErrors.isEmpty();
    }

    public int getTotalLinks() {
        return internalLinks + externalLinks + inaccessibleLinks;
    }
}
