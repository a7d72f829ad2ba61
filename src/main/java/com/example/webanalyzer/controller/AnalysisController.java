package com.example.webanalyzer.controller;

import com.example.webanalyzer.dto.AnalysisErrorResponse;
import com.example.webanalyzer.dto.AnalysisRequest;
import com.example.webanalyzer.exception.AnalysisException;
import com.example.webanalyzer.model.WebpageAnalysis;
import com.example.webanalyzer.service.AnalysisResponseMapper;
import com.example.webanalyzer.service.AnalysisService;
import io.micrometer.core.annotation.Timed;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API контроллер для анализа веб-страниц.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AnalysisController {

    static final String SERVICE_NAME = "webpage-analyzer";

    private final AnalysisService analysisService;
    private final AnalysisResponseMapper responseMapper;

    /**
     * Анализирует страницу.
     *
     * POST /api/analyze
     */
    @PostMapping("/analyze")
    @Timed(value = "analysis.http.requests", description = "Time spent serving analyze requests")
    public ResponseEntity<?> analyze(@RequestBody @Valid AnalysisRequest request) {
        String url = request.getUrl();
        log.info("Received analysis request for {}", url);

        try {
            WebpageAnalysis analysis = analysisService.analyze(url);
            return ResponseEntity.ok(responseMapper.toResponse(analysis));
        } catch (AnalysisException e) {
            log.warn("Analysis of {} failed: {}", url, e.getMessage());
            return ResponseEntity.badRequest().body(AnalysisErrorResponse.from(e));
        } catch (Exception e) {
            log.error("Unexpected error while analyzing {}", url, e);
            return ResponseEntity.internalServerError()
                    .body(new AnalysisErrorResponse(500, "Internal server error", url));
        }
    }

    /**
     * Health check эндпоинт.
     *
     * GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", SERVICE_NAME);
        return ResponseEntity.ok(body);
    }

    /**
     * GET /api/status
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, String>> status() {
        return ResponseEntity.ok(Map.of("status", analysisService.getStatus()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<AnalysisErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        FieldError error = e.getBindingResult().getFieldError();
        String message = error != null ? error.getDefaultMessage() : "Invalid request";
        String url = error != null && error.getRejectedValue() != null
                ? String.valueOf(error.getRejectedValue())
                : "";
        log.debug("Rejected analysis request: {}", message);
        return ResponseEntity.badRequest().body(new AnalysisErrorResponse(400, "Invalid URL: " + message, url));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<AnalysisErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.debug("Unreadable analysis request: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .body(new AnalysisErrorResponse(400, "Invalid request format: expected {\"url\": \"...\"}", ""));
    }
}
