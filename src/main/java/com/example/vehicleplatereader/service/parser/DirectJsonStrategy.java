package com.example.vehicleplatereader.service.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

/**
 * Parses the whole reply as a single JSON object. Trailing text makes it fail.
 */
public class DirectJsonStrategy implements ReplyParseStrategy {

    private final ObjectReader reader;

    public DirectJsonStrategy(ObjectMapper objectMapper) {
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    @Override
    public String name() {
        return "direct";
    }

    @Override
    public Optional<ObjectNode> parse(String content) {
        return readObject(reader, content);
    }

    static Optional<ObjectNode> readObject(ObjectReader reader, String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = reader.readTree(candidate.trim());
            return node != null && node.isObject() ? Optional.of((ObjectNode) node) : Optional.empty();
        } catch (JsonProcessingException ex) {
            return Optional.empty();
        }
    }
}
