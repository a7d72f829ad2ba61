package com.example.webanalyzer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Результат анализа в формате API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WebpageAnalysisResponse {
    private String url;
    private String htmlVersion;
    private String pageTitle;
    private Map<String, Integer> headings;
    private int internalLinks;
    private int externalLinks;
    private int inaccessibleLinks;

    @JsonProperty("has_login_form")
    private boolean hasLoginForm;

    /**
     * Момент завершения анализа, RFC 3339 в UTC
     */
    private String analyzedAt;

    /**
     * Длительность обработки, например "150ms" или "1.25s"
     */
    private String processingTime;

    /**
     * Ошибки отдельных проходов; отсутствует, если все проходы успешны
     */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, String> extractionErrors;
}
