package com.example.webanalyzer.service.fetch;

import lombok.Getter;

/**
 * Ошибка загрузки страницы с кодом, близким к HTTP-статусу, и понятным сообщением.
 */
@Getter
public class PageFetchException extends Exception {

    private final int statusCode;

    public PageFetchException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public PageFetchException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}
