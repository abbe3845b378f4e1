package com.example.vehicleplatereader.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Token accounting reported by the text extraction service")
public record TokenUsage(
        @JsonProperty("prompt_tokens") Integer promptTokens,
        @JsonProperty("completion_tokens") Integer completionTokens,
        @JsonProperty("total_tokens") Integer totalTokens) {

    private static final TokenUsage EMPTY = new TokenUsage(null, null, null);

    public static TokenUsage empty() {
        return EMPTY;
    }

    /**
     * Reads the {@code usage} object of a chat completions reply. Missing or
     * non-numeric counters stay {@code null}.
     */
    public static TokenUsage from(JsonNode reply) {
        if (reply == null) {
            return EMPTY;
        }
        JsonNode usage = reply.path("usage");
        if (!usage.isObject()) {
            return EMPTY;
        }
        return new TokenUsage(
                intOrNull(usage.path("prompt_tokens")),
                intOrNull(usage.path("completion_tokens")),
                intOrNull(usage.path("total_tokens")));
    }

    private static Integer intOrNull(JsonNode node) {
        return node.isInt() ? node.asInt() : null;
    }
}
