package com.example.webanalyzer.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Запрос на анализ веб-страницы.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRequest {
    /**
     * Абсолютный адрес страницы (http или https)
     */
    @NotBlank(message = "URL is required")
    @Pattern(regexp = "(?i)^https?://.+", message = "URL must start with http:// or https://")
    private String url;
}
