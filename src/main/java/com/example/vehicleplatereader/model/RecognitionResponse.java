package com.example.vehicleplatereader.model;

import com.example.vehicleplatereader.service.RecognitionError;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Body of {@code POST /recognize}. Successful replies carry the plate fields,
 * failures carry the error classification and a human readable message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Result of a plate recognition request")
public record RecognitionResponse(
        @Schema(description = "Whether the plate text was extracted", example = "true") boolean success,
        @JsonProperty("left_number")
        @Schema(description = "Numeric segment on the left of the plate", example = "12") String leftNumber,
        @JsonProperty("middle_text")
        @Schema(description = "Letter segment in its original script") String middleText,
        @JsonProperty("right_number")
        @Schema(description = "Numeric segment on the right of the plate", example = "34567") String rightNumber,
        @Schema(description = "Model that produced the text", example = "gpt-4.1") String model,
        @Schema(description = "Token usage reported by the extraction service") TokenUsage usage,
        @JsonProperty("error_code")
        @Schema(description = "Machine readable failure classification", example = "NO_PLATE_DETECTED") String errorCode,
        @Schema(description = "Short failure description") String error,
        @Schema(description = "Additional detail about the failure") String message,
        @JsonProperty("raw_response")
        @Schema(description = "Unparsed reply, present when it could not be parsed") String rawResponse) {

    public static RecognitionResponse success(PlateRecord plate, String model, TokenUsage usage) {
        return new RecognitionResponse(true, plate.leftNumber(), plate.middleText(), plate.rightNumber(),
                model, usage, null, null, null, null);
    }

    public static RecognitionResponse failure(RecognitionError error, String message) {
        return failure(error, message, null);
    }

    public static RecognitionResponse failure(RecognitionError error, String message, String rawResponse) {
        return new RecognitionResponse(false, null, null, null, null, null,
                error.name(), error.description(), message, rawResponse);
    }
}
