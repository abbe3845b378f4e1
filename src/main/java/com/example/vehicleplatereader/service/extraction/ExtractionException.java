package com.example.vehicleplatereader.service.extraction;

import com.example.vehicleplatereader.service.RecognitionError;

import java.util.Objects;

/**
 * Transport level failure of the extraction call, already classified.
 */
public class ExtractionException extends RuntimeException {

    private final RecognitionError error;

    public ExtractionException(RecognitionError error, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error");
    }

    public ExtractionException(RecognitionError error, String message) {
        this(error, message, null);
    }

    public RecognitionError error() {
        return error;
    }
}
