package com.example.vehicleplatereader.service.extraction;

import com.example.vehicleplatereader.model.TokenUsage;

/**
 * Unparsed reply of the extraction service.
 */
public record RawExtractionReply(String content, TokenUsage usage, int statusCode) {

    public RawExtractionReply {
        content = content == null ? "" : content;
        usage = usage == null ? TokenUsage.empty() : usage;
    }
}
