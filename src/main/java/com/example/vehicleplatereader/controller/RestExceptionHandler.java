package com.example.vehicleplatereader.controller;

import com.example.vehicleplatereader.model.RecognitionResponse;
import com.example.vehicleplatereader.service.RecognitionError;
import com.example.vehicleplatereader.service.RecognitionException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;

@RestControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(RecognitionException.class)
    public ResponseEntity<RecognitionResponse> handleRecognition(RecognitionException exception, HttpServletRequest request) {
        log.debug("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), exception.getMessage());
        return respond(exception.error(), exception.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<RecognitionResponse> handleMaxUploadSize(MaxUploadSizeExceededException exception) {
        return respond(RecognitionError.PAYLOAD_TOO_LARGE, "Image exceeds the maximum upload size");
    }

    @ExceptionHandler(MultipartException.class)
    public ResponseEntity<RecognitionResponse> handleMultipart(MultipartException exception) {
        return respond(RecognitionError.MISSING_INPUT, "Malformed multipart request: " + exception.getMessage());
    }

    /**
     * Anything unexpected gets the same failure body as classified errors. Framework
     * exceptions that already carry an HTTP status (unknown path, wrong method) are
     * left to Spring's default resolution.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<RecognitionResponse> handleUnexpected(Exception exception, HttpServletRequest request) throws Exception {
        if (exception instanceof ErrorResponse) {
            throw exception;
        }
        log.error("Request {} {} failed", request.getMethod(), request.getRequestURI(), exception);
        return respond(RecognitionError.INTERNAL_ERROR, exception.getMessage());
    }

    private static ResponseEntity<RecognitionResponse> respond(RecognitionError error, String message) {
        return ResponseEntity.status(error.status()).body(RecognitionResponse.failure(error, message));
    }
}
