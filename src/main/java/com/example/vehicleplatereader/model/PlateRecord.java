package com.example.vehicleplatereader.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Objects;
import java.util.stream.Stream;

/**
 * The three text segments of a plate. Every field is always set; a segment that
 * could not be read carries {@link #UNREADABLE}.
 */
@Schema(description = "Structured plate text split into its three segments")
public record PlateRecord(
        @JsonProperty("left_number")
        @Schema(description = "Numeric segment on the left of the plate", example = "12") String leftNumber,
        @JsonProperty("middle_text")
        @Schema(description = "Letter segment in its original script", example = "UNREADABLE") String middleText,
        @JsonProperty("right_number")
        @Schema(description = "Numeric segment on the right of the plate", example = "34567") String rightNumber) {

    public static final String UNREADABLE = "UNREADABLE";

    public static final String LEFT_NUMBER = "left_number";
    public static final String MIDDLE_TEXT = "middle_text";
    public static final String RIGHT_NUMBER = "right_number";

    public PlateRecord {
        Objects.requireNonNull(leftNumber, "leftNumber");
        Objects.requireNonNull(middleText, "middleText");
        Objects.requireNonNull(rightNumber, "rightNumber");
    }

    @JsonIgnore
    public long unreadableCount() {
        return Stream.of(leftNumber, middleText, rightNumber)
                .filter(UNREADABLE::equals)
                .count();
    }
}
