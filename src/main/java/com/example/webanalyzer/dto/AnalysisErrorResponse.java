package com.example.webanalyzer.dto;

import com.example.webanalyzer.exception.AnalysisException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ответ об ошибке анализа.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AnalysisErrorResponse {
    private int statusCode;
    private String errorMessage;
    private String url;

    public static AnalysisErrorResponse from(AnalysisException e) {
        return new AnalysisErrorResponse(e.getStatusCode(), e.getErrorMessage(), e.getUrl());
    }
}
