package com.example.vehicleplatereader.config;

import java.time.Duration;
import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

/**
 * Process-wide settings, bound once at startup and never mutated afterwards.
 */
@Validated
@ConfigurationProperties(prefix = "plate-reader")
public record PlateReaderProperties(
        @Valid @DefaultValue OpenAi openai,
        @Valid @DefaultValue Upload upload,
        @Valid @DefaultValue Detector detector,
        @Valid @DefaultValue Cors cors) {

    /**
     * Connection settings for the OpenAI-compatible chat completions endpoint.
     */
    public record OpenAi(
            String apiKey,
            @NotBlank @DefaultValue("gpt-4.1") String model,
            @NotBlank @DefaultValue("https://api.openai.com/v1") String baseUrl,
            @DefaultValue("30s") Duration timeout,
            @DefaultValue("10s") Duration connectTimeout,
            @Positive @DefaultValue("300") int maxTokens,
            @DefaultValue("true") boolean jsonResponseMode) {

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    public record Upload(
            String directory,
            @NotEmpty @DefaultValue({"png", "jpg", "jpeg", "gif", "bmp"}) List<String> allowedExtensions,
            @DefaultValue("16MB") DataSize maxFileSize) {
    }

    /**
     * YOLO detector settings. When {@code modelPath} does not point to an existing
     * ONNX file the whole image is treated as the plate region.
     */
    public record Detector(
            String modelPath,
            @Positive @DefaultValue("640") int inputSize,
            @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.25") double confThreshold,
            @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.45") double nmsThreshold) {
    }

    /**
     * Cross-origin access for browser clients, applied to every route.
     */
    public record Cors(
            @NotEmpty @DefaultValue("*") List<String> allowedOrigins,
            @NotEmpty @DefaultValue({"GET", "POST", "OPTIONS"}) List<String> allowedMethods) {
    }
}
