package dev.pekelund.wastelog.analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot application entry point for the food waste analyzer service.
 */
@SpringBootApplication
public class WasteAnalyzerApplication {

    public static void main(String[] args) {
        SpringApplication.run(WasteAnalyzerApplication.class, args);
    }
}
