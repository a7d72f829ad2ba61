package com.example.webanalyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WebpageAnalyzerApplication {

    public static void main(String[] args) {
        SpringApplication.run(WebpageAnalyzerApplication.class, args);
    }
}
