package com.example.webanalyzer.service.parse;

import org.jsoup.nodes.Document;

/**
 * Разбор разметки в дерево документа.
 */
public interface DocumentParser {

    /**
     * @param content     байты ответа
     * @param contentType значение заголовка Content-Type, может быть {@code null}
     * @param baseUrl     адрес страницы
     * @return документ; вызывающая сторона не должна его изменять
     */
    Document parse(byte[] content, String contentType, String baseUrl) throws DocumentParseException;
}
