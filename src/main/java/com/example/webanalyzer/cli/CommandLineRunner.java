package com.example.webanalyzer.cli;

import com.example.webanalyzer.dto.WebpageAnalysisResponse;
import com.example.webanalyzer.exception.AnalysisException;
import com.example.webanalyzer.model.WebpageAnalysis;
import com.example.webanalyzer.service.AnalysisResponseMapper;
import com.example.webanalyzer.service.AnalysisService;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * CLI интерфейс для анализа страницы из командной строки.
 *
 * Примеры использования:
 *
 * java -jar webpage-analyzer.jar --url=https://example.com
 *
 * java -jar webpage-analyzer.jar --url=https://example.com --format=json
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandLineRunner implements ApplicationRunner {

    private final AnalysisService analysisService;
    private final AnalysisResponseMapper responseMapper;
    private final ObjectMapper objectMapper;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption("url")) {
            log.info("Starting in REST API mode. Use --url=<page> for CLI mode.");
            return;
        }

        log.info("Starting in CLI mode");
        System.exit(runCli(args));
    }

    /**
     * @return код завершения процесса
     */
    int runCli(ApplicationArguments args) {
        String url = getOption(args, "url", "");
        String format = getOption(args, "format", "text");

        try {
            WebpageAnalysis analysis = analysisService.analyze(url);
            WebpageAnalysisResponse response = responseMapper.toResponse(analysis);
            if ("json".equalsIgnoreCase(format)) {
                System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(response));
            } else {
                printSummary(response);
            }
            return 0;
        } catch (AnalysisException e) {
            System.err.println("Analysis failed: HTTP " + e.getStatusCode() + ": " + e.getErrorMessage());
            return 1;
        } catch (Exception e) {
            log.error("CLI execution failed: {}", e.getMessage(), e);
            return 1;
        }
    }

    private void printSummary(WebpageAnalysisResponse response) {
        System.out.println();
        System.out.println("═══════════════════════════════════════════════════════════");
        System.out.println("                      ANALYSIS SUMMARY                      ");
        System.out.println("═══════════════════════════════════════════════════════════");
        System.out.println();
        System.out.println("  URL:                  " + response.getUrl());
        System.out.println("  HTML version:         " + response.getHtmlVersion());
        System.out.println("  Title:                " + response.getPageTitle());
        System.out.println("  Headings:             " + response.getHeadings());
        System.out.println("  Internal links:       " + response.getInternalLinks());
        System.out.println("  External links:       " + response.getExternalLinks());
        System.out.println("  Inaccessible links:   " + response.getInaccessibleLinks());
        System.out.println("  Login form:           " + (response.isHasLoginForm() ? "yes" : "no"));
        System.out.println("  Analyzed at:          " + response.getAnalyzedAt());
        System.out.println("  Processing time:      " + response.getProcessingTime());

        if (response.getExtractionErrors() != null && !response.getExtractionErrors().isEmpty()) {
            System.out.println();
            System.out.println("  Extraction errors:");
            response.getExtractionErrors().forEach((pass, message) ->
                    System.out.println("    - " + pass + ": " + message));
        }
        System.out.println();
    }

    private String getOption(ApplicationArguments args, String name, String defaultValue) {
        if (args.containsOption(name) && !args.getOptionValues(name).isEmpty()) {
            return args.getOptionValues(name).get(0);
        }
        return defaultValue;
    }
}
