package com.example.vehicleplatereader.service.pipeline;

import com.example.vehicleplatereader.model.PlateRecord;
import com.example.vehicleplatereader.model.TokenUsage;
import com.example.vehicleplatereader.service.RecognitionError;

import java.util.Objects;

/**
 * Terminal state of the recognition pipeline. Exactly one of {@code plate} and
 * {@code error} is set.
 *
 * @param plate      extracted plate on success
 * @param model      model that served the extraction, when it was reached
 * @param usage      token usage, when the extraction service answered
 * @param error      failure classification
 * @param message    failure detail
 * @param rawContent unparsed reply for parse failures
 */
public record RecognitionOutcome(
        PlateRecord plate,
        String model,
        TokenUsage usage,
        RecognitionError error,
        String message,
        String rawContent) {

    public RecognitionOutcome {
        if ((plate == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of plate and error must be set");
        }
    }

    public static RecognitionOutcome success(PlateRecord plate, String model, TokenUsage usage) {
        return new RecognitionOutcome(Objects.requireNonNull(plate, "plate"), model, usage, null, null, null);
    }

    public static RecognitionOutcome failure(RecognitionError error, String message) {
        return new RecognitionOutcome(null, null, null, Objects.requireNonNull(error, "error"), message, null);
    }

    public static RecognitionOutcome parseFailure(String rawContent, String model, TokenUsage usage) {
        return new RecognitionOutcome(null, model, usage, RecognitionError.EXTRACTION_PARSE_FAILURE,
                "The extraction service reply did not contain a JSON object", rawContent);
    }

    public boolean isSuccess() {
        return plate != null;
    }
}
