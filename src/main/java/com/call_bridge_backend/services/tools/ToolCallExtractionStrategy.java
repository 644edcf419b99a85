package com.call_bridge_backend.services.tools;

import com.call_bridge_backend.dto.ToolCall;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Recognizes one wire shape of a single tool call. Returns empty when the node is not in that shape.
 */
public interface ToolCallExtractionStrategy {

    Optional<ToolCall> extract(JsonNode node);
}
