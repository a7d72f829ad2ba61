package com.example.webanalyzer.cache;

import com.example.webanalyzer.model.WebpageAnalysis;

import java.util.Optional;

/**
 * Кэш результатов анализа. Ключ: адрес страницы в точности как в запросе.
 */
public interface AnalysisCache {

    Optional<WebpageAnalysis> get(String url);

    void put(String url, WebpageAnalysis analysis);

    int size();

    void clear();
}
