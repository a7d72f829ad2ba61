package com.example.webanalyzer.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Метрики анализа веб-страниц.
 */
@Component
public class AnalysisMetrics {

    private final MeterRegistry meterRegistry;
    private final Timer totalDuration;
    private final Counter completedTotal;
    private final Counter failedTotal;
    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final AtomicInteger activeRequests;

    public AnalysisMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.totalDuration = Timer.builder("analysis.duration.total")
            .description("Total duration of page analysis, cache hits excluded")
            .register(meterRegistry);

        this.completedTotal = Counter.builder("analysis.completed.total")
            .description("Total number of completed analyses")
            .register(meterRegistry);

        this.failedTotal = Counter.builder("analysis.failed.total")
            .description("Total number of failed analyses")
            .register(meterRegistry);

        this.cacheHits = Counter.builder("analysis.cache.hits")
            .description("Analyses served from the result cache")
            .register(meterRegistry);

        this.cacheMisses = Counter.builder("analysis.cache.misses")
            .description("Analyses not found in the result cache")
            .register(meterRegistry);

        this.activeRequests = new AtomicInteger(0);
        Gauge.builder("analysis.requests.active", activeRequests, AtomicInteger::get)
            .description("Number of analyses in progress")
            .register(meterRegistry);
    }

    /**
     * Создаёт Timer.Sample для измерения времени шага.
     */
    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordTotalDuration(Timer.Sample sample) {
        sample.stop(totalDuration);
    }

    /**
     * Записывает время выполнения шага (fetch, parse, extract).
     */
    public void recordStepDuration(Timer.Sample sample, String stepName) {
        Timer stepTimer = Timer.builder("analysis.step.duration")
            .tag("step", stepName)
            .description("Duration of analysis step")
            .register(meterRegistry);
        sample.stop(stepTimer);
    }

    /**
     * Отмечает ошибку прохода извлечения.
     */
    public void recordPassFailed(String passName) {
        Counter.builder("analysis.pass.failed")
            .tag("pass", passName)
            .description("Extraction passes that ended with an error")
            .register(meterRegistry)
            .increment();
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    public void incrementActiveRequests() {
        activeRequests.incrementAndGet();
    }

    public void decrementActiveRequests() {
        activeRequests.decrementAndGet();
    }

    public void recordCompleted() {
        completedTotal.increment();
    }

    public void recordFailed() {
        failedTotal.increment();
    }
}
