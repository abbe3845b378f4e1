package com.example.vehicleplatereader.controller;

import com.example.vehicleplatereader.config.PlateReaderProperties;
import com.example.vehicleplatereader.model.HealthResponse;
import com.example.vehicleplatereader.model.RecognitionResponse;
import com.example.vehicleplatereader.service.RecognitionError;
import com.example.vehicleplatereader.service.RecognitionException;
import com.example.vehicleplatereader.service.intake.ImageIntakeValidator;
import com.example.vehicleplatereader.service.intake.ImageSubmission;
import com.example.vehicleplatereader.service.pipeline.ApiResult;
import com.example.vehicleplatereader.service.pipeline.RecognitionPipeline;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@Tag(name = "Plate recognition", description = "Licence plate detection and text extraction endpoints")
public class PlateRecognitionController {

    private static final Logger log = LoggerFactory.getLogger(PlateRecognitionController.class);

    static final String HEALTH_MESSAGE = "License Plate Recognition API is running";

    private final ImageIntakeValidator validator;
    private final RecognitionPipeline pipeline;
    private final PlateReaderProperties properties;
    private final Map<String, Object> info;

    public PlateRecognitionController(ImageIntakeValidator validator,
                                      RecognitionPipeline pipeline,
                                      PlateReaderProperties properties) {
        this.validator = validator;
        this.pipeline = pipeline;
        this.properties = properties;
        this.info = describe(properties, List.copyOf(validator.allowedExtensions()));
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Reports whether the service is up and an extraction API key is configured.")
    public HealthResponse health() {
        return new HealthResponse("healthy", HEALTH_MESSAGE, properties.openai().isConfigured());
    }

    @GetMapping("/info")
    @Operation(summary = "API information", description = "Lists the endpoints, an example request and the supported image formats.")
    public Map<String, Object> info() {
        return info;
    }

    @PostMapping(value = "/recognize", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Recognize a plate from an uploaded image",
            description = "Accepts the image as form-data under the key \"image\" or \"file\".")
    public ResponseEntity<RecognitionResponse> recognizeMultipart(
            @RequestPart(value = "image", required = false) MultipartFile image,
            @RequestPart(value = "file", required = false) MultipartFile file) {
        return respond(validator.validateMultipart(image, file));
    }

    @PostMapping(value = "/recognize", consumes = "image/*")
    @Operation(summary = "Recognize a plate from a raw image body",
            description = "Accepts the image bytes as the request body with an image content type.")
    public ResponseEntity<RecognitionResponse> recognizeRawBody(
            @RequestBody(required = false) byte[] body,
            @RequestHeader(HttpHeaders.CONTENT_TYPE) String contentType) {
        return respond(validator.validateRawBody(body, contentType));
    }

    @PostMapping("/recognize")
    @Operation(hidden = true)
    public ResponseEntity<RecognitionResponse> recognizeUnsupported(
            @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType) {
        log.debug("Rejected recognition request with content type {}", contentType);
        throw new RecognitionException(RecognitionError.MISSING_INPUT, ImageIntakeValidator.NO_IMAGE_MESSAGE);
    }

    private ResponseEntity<RecognitionResponse> respond(ImageSubmission submission) {
        ApiResult result = pipeline.recognize(submission);
        return ResponseEntity.status(result.status()).body(result.body());
    }

    private static Map<String, Object> describe(PlateReaderProperties properties, List<String> formats) {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("GET /health", "Health check");
        endpoints.put("GET /info", "API information");
        endpoints.put("POST /recognize", "Recognize license plate from image");

        Map<String, Object> recognize = new LinkedHashMap<>();
        recognize.put("description", "Upload an image to recognize license plate");
        recognize.put("parameters", Map.of(
                "image (file)", "Image file (form-data), \"file\" is accepted as well",
                "raw body", "Image bytes with an image/* content type"));
        recognize.put("response_fields", List.of("left_number", "middle_text", "right_number", "model", "usage"));
        recognize.put("example", "curl -X POST -F \"image=@vehicle.jpg\" http://localhost:5000/recognize");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", "Vehicle License Plate Recognition API");
        body.put("version", "1.0.0");
        body.put("endpoints", endpoints);
        body.put("usage", Map.of("POST /recognize", recognize));
        body.put("supported_formats", formats);
        body.put("model", properties.openai().model());
        return Collections.unmodifiableMap(body);
    }
}
