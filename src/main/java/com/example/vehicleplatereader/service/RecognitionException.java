package com.example.vehicleplatereader.service;

import java.util.Objects;

/**
 * Rejects a submission before any pipeline work starts.
 */
public class RecognitionException extends RuntimeException {

    private final RecognitionError error;

    public RecognitionException(RecognitionError error, String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "error");
    }

    public RecognitionError error() {
        return error;
    }
}
