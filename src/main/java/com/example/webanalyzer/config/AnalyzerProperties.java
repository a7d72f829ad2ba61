package com.example.webanalyzer.config;

import com.example.webanalyzer.service.extraction.SpecialLinkPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Настройки анализатора веб-страниц.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "analyzer")
public class AnalyzerProperties {

    private FetchConfig fetch = new FetchConfig();
    private PoolConfig pool = new PoolConfig();
    private LinksConfig links = new LinksConfig();
    private ExtractionConfig extraction = new ExtractionConfig();
    private CacheConfig cache = new CacheConfig();

    @Data
    public static class FetchConfig {
        /**
         * Таймаут загрузки страницы (соединение + ответ)
         */
        private Duration timeout = Duration.ofSeconds(30);

        /**
         * User-Agent, с которым выполняются запросы
         */
        private String userAgent = "WebpageAnalyzer/1.0";

        /**
         * Максимальный размер тела ответа в байтах
         */
        private long maxBodyBytes = 10L * 1024 * 1024;

        /**
         * Следовать ли редиректам
         */
        private boolean followRedirects = true;
    }

    @Data
    public static class PoolConfig {
        /**
         * Количество рабочих потоков (по одному на проход извлечения)
         */
        private int workers = 5;

        /**
         * Ёмкость очереди задач; 0 означает workers * 2
         */
        private int queueCapacity = 0;

        public int effectiveQueueCapacity() {
            return queueCapacity > 0 ? queueCapacity : workers * 2;
        }
    }

    @Data
    public static class LinksConfig {
        /**
         * Как классифицировать ссылки mailto: и tel:
         */
        private SpecialLinkPolicy specialLinkPolicy = SpecialLinkPolicy.INTERNAL;
    }

    @Data
    public static class ExtractionConfig {
        /**
         * Падать ли всему запросу при ошибке одного прохода
         */
        private boolean failOnPassError = false;
    }

    @Data
    public static class CacheConfig {
        /**
         * Включён ли кэш результатов
         */
        private boolean enabled = true;

        /**
         * Максимальное число записей; 0 означает без ограничения
         */
        private int maxEntries = 0;
    }
}
