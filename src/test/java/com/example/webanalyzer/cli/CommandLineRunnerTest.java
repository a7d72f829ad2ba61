package com.example.webanalyzer.cli;

import com.example.webanalyzer.exception.AnalysisException;
import com.example.webanalyzer.model.WebpageAnalysis;
import com.example.webanalyzer.service.AnalysisResponseMapper;
import com.example.webanalyzer.service.AnalysisService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.*;

class CommandLineRunnerTest {

    private AnalysisService analysisService;
    private CommandLineRunner runner;

    @BeforeEach
    void setUp() {
        analysisService = mock(AnalysisService.class);
        runner = new CommandLineRunner(analysisService, new AnalysisResponseMapper(), new ObjectMapper());
    }

    @Test
    void shouldAnalyzeUrlFromArguments() {
        // Given
        when(analysisService.analyze("https://example.com")).thenReturn(WebpageAnalysis.builder()
                .url("https://example.com")
                .pageTitle("Example Domain")
                .analyzedAt(Instant.now())
                .processingTime(Duration.ofMillis(42))
                .build());

        // When
        int exitCode = runner.runCli(new DefaultApplicationArguments("--url=https://example.com", "--format=json"));

        // Then
        assertEquals(0, exitCode);
        verify(analysisService).analyze("https://example.com");
    }

    @Test
    void shouldPassUrlArgumentUnchanged() {
        // Given
        String url = "https://example.com/page ";
        when(analysisService.analyze(url)).thenReturn(WebpageAnalysis.builder()
                .url(url)
                .analyzedAt(Instant.now())
                .processingTime(Duration.ofMillis(5))
                .build());

        // When
        int exitCode = runner.runCli(new DefaultApplicationArguments("--url=" + url));

        // Then
        assertEquals(0, exitCode);
        verify(analysisService).analyze(url);
    }

    @Test
    void shouldExitWithErrorWhenAnalysisFails() {
        when(analysisService.analyze(anyString()))
                .thenThrow(new AnalysisException(404, "Not found", "https://missing.example"));

        int exitCode = runner.runCli(new DefaultApplicationArguments("--url=https://missing.example"));

        assertEquals(1, exitCode);
    }

    @Test
    void shouldStayInServerModeWithoutUrl() {
        runner.run(new DefaultApplicationArguments("--server.port=0"));

        verifyNoInteractions(analysisService);
    }
}
