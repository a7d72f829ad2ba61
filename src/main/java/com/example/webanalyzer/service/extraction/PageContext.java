package com.example.webanalyzer.service.extraction;

import lombok.Value;
import org.jsoup.nodes.Document;

/**
 * Входные данные прохода извлечения: документ и адрес страницы.
 * Документ общий для всех проходов одного запроса и не изменяется.
 */
@Value
public class PageContext {
    Document document;
    String pageUrl;
}
