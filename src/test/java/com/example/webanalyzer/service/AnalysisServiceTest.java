package com.example.webanalyzer.service;

import com.example.webanalyzer.cache.InMemoryAnalysisCache;
import com.example.webanalyzer.config.AnalyzerProperties;
import com.example.webanalyzer.exception.AnalysisException;
import com.example.webanalyzer.metrics.AnalysisMetrics;
import com.example.webanalyzer.model.WebpageAnalysis;
import com.example.webanalyzer.service.extraction.ExtractionPass;
import com.example.webanalyzer.service.extraction.HeadingsExtractor;
import com.example.webanalyzer.service.extraction.HtmlVersionExtractor;
import com.example.webanalyzer.service.extraction.LinkClassifier;
import com.example.webanalyzer.service.extraction.LinksExtractor;
import com.example.webanalyzer.service.extraction.LoginFormDetector;
import com.example.webanalyzer.service.extraction.LoginFormExtractor;
import com.example.webanalyzer.service.extraction.PageContext;
import com.example.webanalyzer.service.extraction.PageTitleExtractor;
import com.example.webanalyzer.service.extraction.SpecialLinkPolicy;
import com.example.webanalyzer.service.fetch.FetchedPage;
import com.example.webanalyzer.service.fetch.PageFetchException;
import com.example.webanalyzer.service.fetch.PageFetcher;
import com.example.webanalyzer.service.parse.JsoupDocumentParser;
import com.example.webanalyzer.worker.WorkerPool;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AnalysisServiceTest {

    private static final String URL = "https://example.com";

    static final String EXAMPLE_HTML = "<!doctype html><html><head><title>Example Domain</title>"
            + "<meta charset=\"utf-8\"></head><body><div><h1>Example Domain</h1>"
            + "<p>This domain is for use in illustrative examples in documents.</p>"
            + "<p><a href=\"https://www.iana.org/domains/example\">More information...</a></p>"
            + "</div></body></html>";

    private PageFetcher pageFetcher;
    private WorkerPool workerPool;
    private InMemoryAnalysisCache cache;
    private SimpleMeterRegistry registry;
    private AnalyzerProperties properties;

    @BeforeEach
    void setUp() {
        pageFetcher = mock(PageFetcher.class);
        workerPool = new WorkerPool(2, 4);
        cache = new InMemoryAnalysisCache();
        registry = new SimpleMeterRegistry();
        properties = new AnalyzerProperties();
    }

    @AfterEach
    void tearDown() {
        workerPool.shutdown();
    }

    private AnalysisService service(List<ExtractionPass<?>> passes) {
        AnalysisMetrics metrics = new AnalysisMetrics(registry);
        AnalysisEngine engine = new AnalysisEngine(passes, workerPool, metrics);
        return new AnalysisService(pageFetcher, new JsoupDocumentParser(), engine, cache, metrics, properties, workerPool);
    }

    private AnalysisService service() {
        return service(List.of(
                new HtmlVersionExtractor(),
                new PageTitleExtractor(),
                new HeadingsExtractor(),
                new LinksExtractor(new LinkClassifier(SpecialLinkPolicy.INTERNAL)),
                new LoginFormExtractor(new LoginFormDetector())));
    }

    private static FetchedPage page(int status, String html) {
        return FetchedPage.builder()
                .statusCode(status)
                .contentType("text/html; charset=UTF-8")
                .body(html.getBytes(StandardCharsets.UTF_8))
                .build();
    }

    @Test
    void shouldAnalyzeExampleDomain() throws Exception {
        // Given
        when(pageFetcher.fetch(URL)).thenReturn(page(200, EXAMPLE_HTML));

        // When
        WebpageAnalysis analysis = service().analyze(URL);

        // Then
        assertEquals(URL, analysis.getUrl());
        assertEquals("HTML5 (implied)", analysis.getHtmlVersion());
        assertEquals("Example Domain", analysis.getPageTitle());
        assertEquals(Map.of("h1", 1), analysis.getHeadings());
        assertEquals(0, analysis.getInternalLinks());
        assertEquals(1, analysis.getExternalLinks());
        assertEquals(0, analysis.getInaccessibleLinks());
        assertFalse(analysis.isLoginForm());
        assertNotNull(analysis.getAnalyzedAt());
        assertNotNull(analysis.getProcessingTime());
        assertFalse(analysis.getProcessingTime().isNegative());
        assertTrue(analysis.getExtractionErrors().isEmpty());
        assertEquals(1.0, registry.get("analysis.completed.total").counter().count());
    }

    @Test
    void shouldCountRelativeLinkAsInternalAndOtherHostAsExternal() throws Exception {
        // Given
        String html = "<!DOCTYPE html><html><head><title>Example Domain</title></head>"
                + "<body><a href=\"/about\">x</a><a href=\"https://other.com\">y</a></body></html>";
        when(pageFetcher.fetch(URL)).thenReturn(page(200, html));

        // When
        WebpageAnalysis analysis = service().analyze(URL);

        // Then
        assertEquals("HTML5 (implied)", analysis.getHtmlVersion());
        assertEquals("Example Domain", analysis.getPageTitle());
        assertEquals(1, analysis.getInternalLinks());
        assertEquals(1, analysis.getExternalLinks());
        assertEquals(0, analysis.getInaccessibleLinks());
        assertFalse(analysis.isLoginForm());
        assertTrue(analysis.getHeadings().isEmpty());
        assertTrue(analysis.getExtractionErrors().isEmpty());
    }

    @Test
    void shouldServeRepeatedRequestFromCache() throws Exception {
        // Given
        when(pageFetcher.fetch(URL)).thenReturn(page(200, EXAMPLE_HTML));
        AnalysisService service = service();

        // When
        WebpageAnalysis first = service.analyze(URL);
        WebpageAnalysis second = service.analyze(URL);

        // Then
        verify(pageFetcher, times(1)).fetch(URL);
        assertEquals(first.getAnalyzedAt(), second.getAnalyzedAt());
        assertEquals(first, second);
        assertEquals(1.0, registry.get("analysis.cache.hits").counter().count());
        assertEquals(1.0, registry.get("analysis.cache.misses").counter().count());
    }

    @Test
    void shouldFailOnNonOkStatus() throws Exception {
        // Given
        when(pageFetcher.fetch(URL)).thenReturn(page(404, "<html></html>"));
        AnalysisService service = service();

        // When
        AnalysisException error = assertThrows(AnalysisException.class, () -> service.analyze(URL));

        // Then
        assertEquals(404, error.getStatusCode());
        assertTrue(error.getErrorMessage().startsWith("Not found"));
        assertEquals(URL, error.getUrl());
        assertEquals(0, cache.size());
        assertEquals(1.0, registry.get("analysis.failed.total").counter().count());
    }

    @Test
    void shouldPropagateFetchErrorCode() throws Exception {
        when(pageFetcher.fetch(URL)).thenThrow(new PageFetchException(404,
                "DNS resolution failed: The domain could not be found. Please check if the URL is correct."));

        AnalysisException error = assertThrows(AnalysisException.class, () -> service().analyze(URL));

        assertEquals(404, error.getStatusCode());
        assertTrue(error.getErrorMessage().startsWith("DNS resolution failed"));
        assertInstanceOf(PageFetchException.class, error.getCause());
    }

    @Test
    void shouldReturnButNotCachePartialResult() throws Exception {
        // Given
        when(pageFetcher.fetch(URL)).thenReturn(page(200, EXAMPLE_HTML));
        List<ExtractionPass<?>> passes = new ArrayList<>();
        passes.add(new PageTitleExtractor());
        passes.add(failingPass());
        AnalysisService service = service(passes);

        // When
        WebpageAnalysis first = service.analyze(URL);
        service.analyze(URL);

        // Then
        assertEquals("Example Domain", first.getPageTitle());
        assertEquals(Map.of("failing", "pass failed"), first.getExtractionErrors());
        verify(pageFetcher, times(2)).fetch(URL);
        assertEquals(0, cache.size());
    }

    @Test
    void shouldFailWholeRequestWhenConfigured() throws Exception {
        when(pageFetcher.fetch(URL)).thenReturn(page(200, EXAMPLE_HTML));
        properties.getExtraction().setFailOnPassError(true);
        AnalysisService service = service(List.of(new PageTitleExtractor(), failingPass()));

        AnalysisException error = assertThrows(AnalysisException.class, () -> service.analyze(URL));

        assertEquals(500, error.getStatusCode());
        assertTrue(error.getErrorMessage().contains("failing"));
    }

    @Test
    void shouldReportStatus() {
        String status = service().getStatus();

        assertTrue(status.startsWith(AnalysisService.READY_STATUS));
        assertTrue(status.contains("workers: 2"));
        assertTrue(status.contains("cached results: 0"));
    }

    private static ExtractionPass<String> failingPass() {
        return new ExtractionPass<>() {
            @Override
            public String getName() {
                return "failing";
            }

            @Override
            public String extract(PageContext context) {
                throw new IllegalStateException("pass failed");
            }

            @Override
            public void apply(String value, WebpageAnalysis.WebpageAnalysisBuilder builder) {
            }
        };
    }
}
