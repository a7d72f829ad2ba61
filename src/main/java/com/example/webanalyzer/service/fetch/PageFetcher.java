package com.example.webanalyzer.service.fetch;

/**
 * Загрузка страницы по URL.
 */
public interface PageFetcher {

    /**
     * Загружает страницу. Ответ с любым HTTP-статусом возвращается как есть;
     * исключение означает, что ответ получить не удалось.
     *
     * @param url абсолютный http/https адрес
     * @return тело и статус ответа
     * @throws PageFetchException ошибка сети, DNS, TLS, таймаут или некорректный URL
     */
    FetchedPage fetch(String url) throws PageFetchException;
}
