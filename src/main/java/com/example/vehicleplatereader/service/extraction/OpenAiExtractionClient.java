package com.example.vehicleplatereader.service.extraction;

import com.example.vehicleplatereader.config.PlateReaderProperties;
import com.example.vehicleplatereader.model.TokenUsage;
import com.example.vehicleplatereader.service.RecognitionError;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;

/**
 * Client for an OpenAI compatible {@code /chat/completions} endpoint. The reply
 * content is returned as-is; interpreting it is left to the parser.
 */
@Component
public class OpenAiExtractionClient implements ExtractionClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiExtractionClient.class);

    static final String COMPLETIONS_PATH = "/chat/completions";

    private final RestClient http;
    private final PlateReaderProperties.OpenAi settings;
    private final ObjectMapper objectMapper;

    public OpenAiExtractionClient(@Qualifier("extractionRestClient") RestClient http,
                                  PlateReaderProperties properties,
                                  ObjectMapper objectMapper) {
        this.http = http;
        this.settings = properties.openai();
        this.objectMapper = objectMapper;
    }

    @Override
    public RawExtractionReply extract(ExtractionRequest request) {
        if (!settings.isConfigured()) {
            throw new ExtractionException(RecognitionError.EXTRACTION_SERVICE_ERROR,
                    "OpenAI API key is not configured. Set the OPENAI_API_KEY environment variable.");
        }

        ObjectNode payload = buildPayload(request);
        long started = System.nanoTime();
        String body;
        try {
            body = http.post()
                    .uri(COMPLETIONS_PATH)
                    .headers(headers -> headers.setBearerAuth(settings.apiKey()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException ex) {
            int status = ex.getStatusCode().value();
            String detail = serviceMessage(ex.getResponseBodyAsString());
            log.warn("Extraction service returned HTTP {} for model {}: {}", status, request.model(), detail);
            throw new ExtractionException(RecognitionError.EXTRACTION_SERVICE_ERROR,
                    "Extraction service returned HTTP " + status + ": " + detail, ex);
        } catch (ResourceAccessException ex) {
            if (isTimeout(ex)) {
                log.warn("Extraction call timed out after {}", settings.timeout());
                throw new ExtractionException(RecognitionError.EXTRACTION_TIMEOUT,
                        "Extraction service did not answer within " + settings.timeout().toSeconds() + "s", ex);
            }
            log.warn("Extraction service unreachable at {}: {}", settings.baseUrl(), ex.getMessage());
            throw new ExtractionException(RecognitionError.EXTRACTION_UNREACHABLE,
                    "Extraction service is unreachable: " + ex.getMostSpecificCause().getMessage(), ex);
        } catch (RestClientException ex) {
            throw new ExtractionException(RecognitionError.EXTRACTION_SERVICE_ERROR,
                    "Extraction call failed: " + ex.getMessage(), ex);
        }

        JsonNode reply;
        try {
            reply = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException ex) {
            throw new ExtractionException(RecognitionError.EXTRACTION_SERVICE_ERROR,
                    "Extraction service returned a non JSON envelope", ex);
        }
        if (reply == null || !reply.isObject()) {
            throw new ExtractionException(RecognitionError.EXTRACTION_SERVICE_ERROR,
                    "Extraction service returned an empty envelope");
        }

        TokenUsage usage = TokenUsage.from(reply);
        String content = reply.path("choices").path(0).path("message").path("content").asText("");
        log.debug("Extraction reply received in {} ms, total tokens {}",
                (System.nanoTime() - started) / 1_000_000, usage.totalTokens());
        return new RawExtractionReply(content, usage, 200);
    }

    ObjectNode buildPayload(ExtractionRequest request) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", request.model());

        ArrayNode messages = payload.putArray("messages");
        ObjectNode message = messages.addObject();
        message.put("role", "user");
        ArrayNode content = message.putArray("content");
        content.addObject()
                .put("type", "text")
                .put("text", request.instruction());
        ObjectNode image = content.addObject().put("type", "image_url");
        image.putObject("image_url").put("url", request.dataUri());

        payload.put("max_tokens", request.maxTokens());
        payload.put("temperature", 0);
        if (request.jsonResponseMode()) {
            payload.putObject("response_format").put("type", "json_object");
        }
        return payload;
    }

    private String serviceMessage(String body) {
        if (body == null || body.isBlank()) {
            return "no error details";
        }
        try {
            JsonNode message = objectMapper.readTree(body).path("error").path("message");
            if (message.isTextual() && !message.asText().isBlank()) {
                return message.asText();
            }
        } catch (JsonProcessingException ex) {
            log.debug("Error body is not JSON", ex);
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }

    private static boolean isTimeout(ResourceAccessException ex) {
        Throwable cause = ex.getCause();
        while (cause != null) {
            if (cause instanceof SocketTimeoutException || cause instanceof HttpTimeoutException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
