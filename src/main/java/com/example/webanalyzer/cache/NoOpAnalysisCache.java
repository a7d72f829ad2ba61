package com.example.webanalyzer.cache;

import com.example.webanalyzer.model.WebpageAnalysis;

import java.util.Optional;

/**
 * Кэш, который ничего не хранит (analyzer.cache.enabled=false).
 */
public class NoOpAnalysisCache implements AnalysisCache {

    @Override
    public Optional<WebpageAnalysis> get(String url) {
        return Optional.empty();
    }

    @Override
    public void put(String url, WebpageAnalysis analysis) {
        // не кэшируем
    }

    @Override
    public int size() {
        return 0;
    }

    @Override
    public void clear() {
    }
}
