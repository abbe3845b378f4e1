package com.example.vehicleplatereader.service;

import org.springframework.http.HttpStatus;

/**
 * Terminal failure classifications of a recognition request.
 */
public enum RecognitionError {

    MISSING_INPUT(HttpStatus.BAD_REQUEST, "No image file provided"),
    UNSUPPORTED_FORMAT(HttpStatus.BAD_REQUEST, "Invalid file type"),
    PAYLOAD_TOO_LARGE(HttpStatus.PAYLOAD_TOO_LARGE, "Image file is too large"),
    NO_PLATE_DETECTED(HttpStatus.BAD_REQUEST, "Could not detect license plate in the image"),
    EXTRACTION_TIMEOUT(HttpStatus.BAD_GATEWAY, "Text extraction service timed out"),
    EXTRACTION_UNREACHABLE(HttpStatus.BAD_GATEWAY, "Text extraction service is unreachable"),
    EXTRACTION_SERVICE_ERROR(HttpStatus.BAD_GATEWAY, "Text extraction service returned an error"),
    EXTRACTION_PARSE_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "Could not parse text extraction response"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");

    private final HttpStatus status;
    private final String description;

    RecognitionError(HttpStatus status, String description) {
        this.status = status;
        this.description = description;
    }

    public HttpStatus status() {
        return status;
    }

    public String description() {
        return description;
    }
}
