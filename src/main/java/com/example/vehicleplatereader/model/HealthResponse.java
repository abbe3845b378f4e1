package com.example.vehicleplatereader.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Service health")
public record HealthResponse(
        @Schema(example = "healthy") String status,
        @Schema(example = "License Plate Recognition API is running") String message,
        @JsonProperty("openai_configured")
        @Schema(description = "Whether an API key for the extraction service is configured") boolean openaiConfigured) {
}
