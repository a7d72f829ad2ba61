package com.example.webanalyzer.integration;

import com.example.webanalyzer.service.AnalysisEngine;
import com.example.webanalyzer.service.fetch.FetchedPage;
import com.example.webanalyzer.service.fetch.PageFetchException;
import com.example.webanalyzer.service.fetch.PageFetcher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Интеграционный тест полного цикла анализа (без сети: загрузка подменена).
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AnalysisIntegrationTest {

    private static final String LOGIN_PAGE = "<!DOCTYPE html><html><head><title>Sign in</title></head><body>"
            + "<h1>Welcome</h1>"
            + "<form action=\"/session\" method=\"post\">"
            + "<input type=\"text\" name=\"user\"><input type=\"password\" name=\"pw\">"
            + "<button type=\"submit\">Sign In</button></form>"
            + "<a href=\"/forgot\">Forgot password?</a>"
            + "<a href=\"https://help.example.org/\">Help</a>"
            + "<a href=\"mailto:support@example.test\">Support</a>"
            + "<a>Nowhere</a>"
            + "</body></html>";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private AnalysisEngine analysisEngine;

    @MockBean
    private PageFetcher pageFetcher;

    private static FetchedPage page(int status, String html) {
        return FetchedPage.builder()
                .statusCode(status)
                .contentType("text/html; charset=UTF-8")
                .body(html.getBytes(StandardCharsets.UTF_8))
                .build();
    }

    @Test
    void shouldRegisterAllExtractionPasses() {
        assertEquals(List.of("html_version", "page_title", "headings", "links", "login_form"),
                analysisEngine.getPassNames());
    }

    @Test
    void shouldAnalyzeLoginPageAndCacheResult() throws Exception {
        // Given
        String url = "https://login.example.test/";
        when(pageFetcher.fetch(url)).thenReturn(page(200, LOGIN_PAGE));
        String request = "{\"url\": \"" + url + "\"}";

        // When & Then
        mockMvc.perform(post("/api/analyze").contentType(MediaType.APPLICATION_JSON).content(request))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.page_title").value("Sign in"))
                .andExpect(jsonPath("$.html_version").value("HTML5 (implied)"))
                .andExpect(jsonPath("$.headings.h1").value(1))
                .andExpect(jsonPath("$.internal_links").value(2))
                .andExpect(jsonPath("$.external_links").value(1))
                .andExpect(jsonPath("$.inaccessible_links").value(1))
                .andExpect(jsonPath("$.has_login_form").value(true));

        mockMvc.perform(post("/api/analyze").contentType(MediaType.APPLICATION_JSON).content(request))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.has_login_form").value(true));

        verify(pageFetcher, times(1)).fetch(url);
    }

    @Test
    void shouldReturnErrorBodyForUnreachablePage() throws Exception {
        String url = "https://down.example.test/";
        when(pageFetcher.fetch(url)).thenThrow(new PageFetchException(503,
                "Connection refused: The server is not accepting connections."));

        mockMvc.perform(post("/api/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\": \"" + url + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status_code").value(503))
                .andExpect(jsonPath("$.url").value(url));
    }

    @Test
    void shouldReportUpstreamStatus() throws Exception {
        String url = "https://private.example.test/";
        when(pageFetcher.fetch(url)).thenReturn(page(403, "<html></html>"));

        mockMvc.perform(post("/api/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\": \"" + url + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status_code").value(403))
                .andExpect(jsonPath("$.error_message").value("Forbidden: Access to the page is denied."));
    }
}
