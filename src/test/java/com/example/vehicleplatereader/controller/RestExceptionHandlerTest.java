package com.example.vehicleplatereader.controller;

import com.example.vehicleplatereader.model.RecognitionResponse;
import com.example.vehicleplatereader.service.RecognitionError;
import com.example.vehicleplatereader.service.RecognitionException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RestExceptionHandlerTest {

    private final RestExceptionHandler handler = new RestExceptionHandler();
    private final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/recognize");

    @Test
    void recognitionExceptionKeepsItsClassification() {
        ResponseEntity<RecognitionResponse> response = handler.handleRecognition(
                new RecognitionException(RecognitionError.UNSUPPORTED_FORMAT, "Allowed types: png"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errorCode()).isEqualTo(RecognitionError.UNSUPPORTED_FORMAT.name());
        assertThat(response.getBody().message()).isEqualTo("Allowed types: png");
    }

    @Test
    void unexpectedExceptionBecomesInternalError() throws Exception {
        ResponseEntity<RecognitionResponse> response = handler.handleUnexpected(new IllegalArgumentException("bad state"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().success()).isFalse();
        assertThat(response.getBody().errorCode()).isEqualTo(RecognitionError.INTERNAL_ERROR.name());
        assertThat(response.getBody().error()).isEqualTo("Internal server error");
        assertThat(response.getBody().message()).isEqualTo("bad state");
    }

    @Test
    void frameworkExceptionsWithOwnStatusAreLeftToSpring() {
        NoResourceFoundException notFound = new NoResourceFoundException(HttpMethod.GET, "missing");

        assertThatThrownBy(() -> handler.handleUnexpected(notFound, request)).isSameAs(notFound);
    }
}
