package com.example.vehicleplatereader.service.parser;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers a flat JSON object wrapped in prose or markdown fences. Only the first
 * brace pair without nested braces is considered.
 */
public class EmbeddedObjectStrategy implements ReplyParseStrategy {

    private static final Pattern FLAT_OBJECT = Pattern.compile("\\{[^{}]*\\}");

    private final ObjectReader reader;

    public EmbeddedObjectStrategy(ObjectMapper objectMapper) {
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    @Override
    public String name() {
        return "embedded-object";
    }

    @Override
    public Optional<ObjectNode> parse(String content) {
        if (content == null) {
            return Optional.empty();
        }
        Matcher matcher = FLAT_OBJECT.matcher(content);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return DirectJsonStrategy.readObject(reader, matcher.group());
    }
}
