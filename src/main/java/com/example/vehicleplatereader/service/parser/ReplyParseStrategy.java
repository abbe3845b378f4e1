package com.example.vehicleplatereader.service.parser;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

/**
 * One step of the reply recovery ladder. Implementations never throw; content
 * they cannot handle yields an empty result.
 */
public interface ReplyParseStrategy {

    String name();

    Optional<ObjectNode> parse(String content);
}
