package com.example.webanalyzer.service.fetch;

import lombok.Builder;
import lombok.Value;

/**
 * Загруженная страница: тело, код ответа и заявленный тип содержимого.
 */
@Value
@Builder
public class FetchedPage {
    byte[] body;
    int statusCode;
    String contentType;

    public boolean isOk() {
        return statusCode == 200;
    }
}
