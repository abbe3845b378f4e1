package com.example.vehicleplatereader.service.pipeline;

import com.example.vehicleplatereader.model.RecognitionResponse;
import org.springframework.http.HttpStatus;

/**
 * Response body paired with the HTTP status it is served with.
 */
public record ApiResult(HttpStatus status, RecognitionResponse body) {
}
