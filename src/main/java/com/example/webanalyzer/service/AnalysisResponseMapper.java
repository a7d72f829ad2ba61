package com.example.webanalyzer.service;

import com.example.webanalyzer.dto.WebpageAnalysisResponse;
import com.example.webanalyzer.model.WebpageAnalysis;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.TreeMap;

/**
 * Маппинг доменной модели в DTO.
 */
@Component
public class AnalysisResponseMapper {

    public WebpageAnalysisResponse toResponse(WebpageAnalysis analysis) {
        return WebpageAnalysisResponse.builder()
                .url(analysis.getUrl())
                .htmlVersion(analysis.getHtmlVersion())
                .pageTitle(analysis.getPageTitle())
                .headings(new TreeMap<>(analysis.getHeadings()))
                .internalLinks(analysis.getInternalLinks())
                .externalLinks(analysis.getExternalLinks())
                .inaccessibleLinks(analysis.getInaccessibleLinks())
                .hasLoginForm(analysis.isLoginForm())
                .analyzedAt(analysis.getAnalyzedAt() != null
                        ? DateTimeFormatter.ISO_INSTANT.format(analysis.getAnalyzedAt())
                        : null)
                .processingTime(DurationFormatter.format(analysis.getProcessingTime()))
                .extractionErrors(new LinkedHashMap<>(analysis.getExtractionErrors()))
                .build();
    }
}
