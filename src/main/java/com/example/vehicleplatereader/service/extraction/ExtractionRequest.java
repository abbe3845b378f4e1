package com.example.vehicleplatereader.service.extraction;

import java.util.Objects;

/**
 * A ready-to-send vision request for one cropped plate.
 *
 * @param model            model identifier sent to the service
 * @param mimeType         MIME type of the encoded image
 * @param base64Image      base64 encoded image bytes
 * @param instruction      fixed instruction text
 * @param maxTokens        upper bound for the reply size
 * @param jsonResponseMode whether a JSON typed reply is requested
 */
public record ExtractionRequest(
        String model,
        String mimeType,
        String base64Image,
        String instruction,
        int maxTokens,
        boolean jsonResponseMode) {

    public ExtractionRequest {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(mimeType, "mimeType");
        Objects.requireNonNull(base64Image, "base64Image");
        Objects.requireNonNull(instruction, "instruction");
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
    }

    public String dataUri() {
        return "data:" + mimeType + ";base64," + base64Image;
    }
}
