package com.example.vehicleplatereader.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs the extraction service settings once the application is ready, with the
 * API key masked.
 */
@Component
public class OpenAiConfigurationReporter {

    private static final Logger log = LoggerFactory.getLogger(OpenAiConfigurationReporter.class);

    private final PlateReaderProperties.OpenAi openai;

    public OpenAiConfigurationReporter(PlateReaderProperties properties) {
        this.openai = properties.openai();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void report() {
        if (!openai.isConfigured()) {
            log.warn("OPENAI_API_KEY is not set. Recognition requests will fail until an API key is configured.");
        } else {
            log.info("OpenAI API key configured: {}", mask(openai.apiKey()));
        }
        log.info("Extraction model {} at {}", openai.model(), openai.baseUrl());
    }

    static String mask(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return "<not set>";
        }
        String key = apiKey.trim();
        if (key.length() <= 12) {
            return "***";
        }
        return key.substring(0, 8) + "..." + key.substring(key.length() - 4);
    }
}
