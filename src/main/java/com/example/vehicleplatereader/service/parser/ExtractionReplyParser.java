package com.example.vehicleplatereader.service.parser;

import com.example.vehicleplatereader.model.PlateRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Converts the raw reply of the extraction service into a {@link PlateRecord}.
 * Strategies are tried in order and the first recovered object wins. Missing
 * fields are filled with {@link PlateRecord#UNREADABLE}; an empty result means
 * no object could be recovered at all.
 */
@Component
public class ExtractionReplyParser {

    private static final Logger log = LoggerFactory.getLogger(ExtractionReplyParser.class);

    private final List<ReplyParseStrategy> strategies;

    @Autowired
    public ExtractionReplyParser(ObjectMapper objectMapper) {
        this(List.of(new DirectJsonStrategy(objectMapper), new EmbeddedObjectStrategy(objectMapper)));
    }

    ExtractionReplyParser(List<ReplyParseStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public Optional<PlateRecord> parse(String content) {
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }
        for (ReplyParseStrategy strategy : strategies) {
            Optional<ObjectNode> recovered = strategy.parse(content);
            if (recovered.isPresent()) {
                log.debug("Reply recovered with the {} strategy", strategy.name());
                return Optional.of(complete(recovered.get()));
            }
        }
        return Optional.empty();
    }

    static PlateRecord complete(ObjectNode node) {
        return new PlateRecord(
                field(node, PlateRecord.LEFT_NUMBER),
                field(node, PlateRecord.MIDDLE_TEXT),
                field(node, PlateRecord.RIGHT_NUMBER));
    }

    // null, arrays and objects count as missing
    private static String field(ObjectNode node, String name) {
        JsonNode value = node.get(name);
        if (value == null || !value.isValueNode() || value.isNull()) {
            return PlateRecord.UNREADABLE;
        }
        return value.asText();
    }
}
