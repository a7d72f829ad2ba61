package com.example.webanalyzer.cache;

import com.example.webanalyzer.model.WebpageAnalysis;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Кэш в памяти процесса под одной блокировкой.
 *
 * При {@code maxEntries > 0} вытесняется запись, к которой дольше всего не обращались.
 * Записи не устаревают.
 */
@Slf4j
public class InMemoryAnalysisCache implements AnalysisCache {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, WebpageAnalysis> entries;
    private final int maxEntries;

    public InMemoryAnalysisCache() {
        this(0);
    }

    public InMemoryAnalysisCache(int maxEntries) {
        if (maxEntries < 0) {
            throw new IllegalArgumentException("maxEntries must not be negative");
        }
        this.maxEntries = maxEntries;
        this.entries = new LinkedHashMap<>(16, 0.75f, maxEntries > 0) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, WebpageAnalysis> eldest) {
                boolean evict = InMemoryAnalysisCache.this.maxEntries > 0
                        && size() > InMemoryAnalysisCache.this.maxEntries;
                if (evict) {
                    log.debug("Evicting cached analysis for {}", eldest.getKey());
                }
                return evict;
            }
        };
    }

    @Override
    public Optional<WebpageAnalysis> get(String url) {
        lock.lock();
        try {
            return Optional.ofNullable(entries.get(url));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(String url, WebpageAnalysis analysis) {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(analysis, "analysis");
        lock.lock();
        try {
            entries.put(url, analysis);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }
}
