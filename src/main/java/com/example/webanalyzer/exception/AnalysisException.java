package com.example.webanalyzer.exception;

import lombok.Getter;

/**
 * Ошибка анализа страницы с числовым кодом, сообщением и адресом страницы.
 */
@Getter
public class AnalysisException extends RuntimeException {

    private final int statusCode;
    private final String errorMessage;
    private final String url;

    public AnalysisException(int statusCode, String errorMessage, String url) {
        this(statusCode, errorMessage, url, null);
    }

    public AnalysisException(int statusCode, String errorMessage, String url, Throwable cause) {
        super(String.format("HTTP %d: %s (URL: %s)", statusCode, errorMessage, url), cause);
        this.statusCode = statusCode;
        this.errorMessage = errorMessage;
        this.url = url;
    }
}
