package com.example.webanalyzer.config;

import com.example.webanalyzer.cache.AnalysisCache;
import com.example.webanalyzer.cache.InMemoryAnalysisCache;
import com.example.webanalyzer.cache.NoOpAnalysisCache;
import com.example.webanalyzer.worker.WorkerPool;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Бины инфраструктуры анализа: пул потоков, кэш, поддержка @Timed.
 */
@Slf4j
@Configuration
public class AnalyzerConfig {

    @Bean(destroyMethod = "shutdown")
    public WorkerPool workerPool(AnalyzerProperties properties) {
        AnalyzerProperties.PoolConfig pool = properties.getPool();
        return new WorkerPool(pool.getWorkers(), pool.effectiveQueueCapacity());
    }

    @Bean
    public AnalysisCache analysisCache(AnalyzerProperties properties) {
        AnalyzerProperties.CacheConfig cache = properties.getCache();
        if (!cache.isEnabled()) {
            log.info("Analysis cache disabled");
            return new NoOpAnalysisCache();
        }
        log.info("Analysis cache enabled, max entries: {}",
                cache.getMaxEntries() > 0 ? cache.getMaxEntries() : "unbounded");
        return new InMemoryAnalysisCache(cache.getMaxEntries());
    }

    /**
     * TimedAspect для поддержки аннотации @Timed.
     */
    @Bean
    @ConditionalOnClass(name = "org.aspectj.lang.ProceedingJoinPoint")
    public TimedAspect timedAspect(MeterRegistry registry) {
        return new TimedAspect(registry);
    }
}
