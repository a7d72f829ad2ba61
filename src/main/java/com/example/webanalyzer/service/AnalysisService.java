package com.example.webanalyzer.service;

import com.example.webanalyzer.cache.AnalysisCache;
import com.example.webanalyzer.config.AnalyzerProperties;
import com.example.webanalyzer.exception.AnalysisException;
import com.example.webanalyzer.metrics.AnalysisMetrics;
import com.example.webanalyzer.model.WebpageAnalysis;
import com.example.webanalyzer.service.fetch.FetchedPage;
import com.example.webanalyzer.service.fetch.HttpStatusMessages;
import com.example.webanalyzer.service.fetch.PageFetchException;
import com.example.webanalyzer.service.fetch.PageFetcher;
import com.example.webanalyzer.service.parse.DocumentParseException;
import com.example.webanalyzer.service.parse.DocumentParser;
import com.example.webanalyzer.worker.WorkerPool;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Анализ веб-страницы: кэш → загрузка → разбор → проходы извлечения → кэш.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisService {

    static final String READY_STATUS = "Service is running and ready for parallel webpage analysis";

    private final PageFetcher pageFetcher;
    private final DocumentParser documentParser;
    private final AnalysisEngine analysisEngine;
    private final AnalysisCache analysisCache;
    private final AnalysisMetrics analysisMetrics;
    private final AnalyzerProperties properties;
    private final WorkerPool workerPool;

    /**
     * Анализирует страницу по адресу.
     *
     * @param url абсолютный http/https адрес; служит и ключом кэша
     * @return результат анализа, возможно из кэша
     * @throws AnalysisException при ошибке загрузки, ответе не 200 или ошибке разбора
     */
    public WebpageAnalysis analyze(String url) {
        Optional<WebpageAnalysis> cached = analysisCache.get(url);
        if (cached.isPresent()) {
            log.debug("Returning cached analysis for {}", url);
            analysisMetrics.recordCacheHit();
            return cached.get();
        }
        analysisMetrics.recordCacheMiss();

        Timer.Sample totalSample = analysisMetrics.startTimer();
        analysisMetrics.incrementActiveRequests();
        long started = System.nanoTime();
        log.info("Analyzing {}", url);

        try {
            // 1. Загрузка
            Timer.Sample fetchSample = analysisMetrics.startTimer();
            FetchedPage page = fetch(url);
            analysisMetrics.recordStepDuration(fetchSample, "fetch");

            // 2. Разбор
            Timer.Sample parseSample = analysisMetrics.startTimer();
            Document document = parse(page, url);
            analysisMetrics.recordStepDuration(parseSample, "parse");

            // 3. Проходы извлечения
            Timer.Sample extractSample = analysisMetrics.startTimer();
            WebpageAnalysis extracted = extract(document, url);
            analysisMetrics.recordStepDuration(extractSample, "extract");

            if (!extracted.isComplete() && properties.getExtraction().isFailOnPassError()) {
                throw new AnalysisException(500,
                        "Failed to analyze page: " + extracted.getExtractionErrors(), url);
            }

            WebpageAnalysis analysis = extracted.toBuilder()
                    .analyzedAt(Instant.now())
                    .processingTime(Duration.ofNanos(System.nanoTime() - started))
                    .build();

            // 4. Кэширование
            if (analysis.isComplete()) {
                store(url, analysis);
            } else {
                log.warn("Analysis of {} is incomplete, not caching: {}", url, analysis.getExtractionErrors());
            }

            log.info("Analysis of {} completed in {} ms", url, analysis.getProcessingTime().toMillis());
            analysisMetrics.recordCompleted();
            return analysis;

        } catch (RuntimeException e) {
            analysisMetrics.recordFailed();
            throw e;
        } finally {
            analysisMetrics.decrementActiveRequests();
            analysisMetrics.recordTotalDuration(totalSample);
        }
    }

    /**
     * Краткое описание готовности сервиса.
     */
    public String getStatus() {
        return String.format("%s (workers: %d, cached results: %d)",
                READY_STATUS, workerPool.getWorkers(), analysisCache.size());
    }

    private FetchedPage fetch(String url) {
        FetchedPage page;
        try {
            page = pageFetcher.fetch(url);
        } catch (PageFetchException e) {
            log.warn("Failed to fetch {}: {}", url, e.getMessage());
            throw new AnalysisException(e.getStatusCode(), e.getMessage(), url, e);
        }
        if (!page.isOk()) {
            log.warn("Fetching {} returned status {}", url, page.getStatusCode());
            throw new AnalysisException(page.getStatusCode(), HttpStatusMessages.forStatus(page.getStatusCode()), url);
        }
        return page;
    }

    private Document parse(FetchedPage page, String url) {
        try {
            return documentParser.parse(page.getBody(), page.getContentType(), url);
        } catch (DocumentParseException e) {
            log.warn("Failed to parse {}: {}", url, e.getMessage());
            throw new AnalysisException(page.getStatusCode(), e.getMessage(), url, e);
        }
    }

    private WebpageAnalysis extract(Document document, String url) {
        try {
            return analysisEngine.extract(document, url);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisException(503, "Analysis interrupted before all passes completed", url, e);
        }
    }

    private void store(String url, WebpageAnalysis analysis) {
        try {
            analysisCache.put(url, analysis);
        } catch (RuntimeException e) {
            log.warn("Failed to cache analysis for {}: {}", url, e.getMessage(), e);
        }
    }
}
