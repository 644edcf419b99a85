package com.call_bridge_backend.services.tools;

import com.call_bridge_backend.dto.ToolCall;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns the tool-call shapes sent by the provider into {@link ToolCall} records.
 *
 * <p>Known shapes: a single object (optionally wrapped in {@code tool_call}, {@code toolCall} or
 * {@code tool}), an object with a nested {@code function}, a flat object, and arrays of those under
 * {@code tool_calls}, {@code toolCalls}, {@code toolCallList} or {@code toolWithToolCallList}.
 * Arguments may be an object or a JSON string. Nothing here throws on bad input.
 */
@Component
@Slf4j
public class ToolCallNormalizer {

    static final List<String> ID_KEYS = List.of("id", "tool_call_id", "toolCallId", "call_id", "callId");
    static final List<String> NAME_KEYS = List.of("name", "tool_name", "action");
    static final List<String> ARGUMENT_KEYS = List.of("arguments", "input", "payload", "parameters", "tool_arguments");
    private static final List<String> ARRAY_KEYS = List.of("tool_calls", "toolCalls", "toolCallList");
    private static final List<String> WRAPPER_KEYS = List.of("tool_call", "toolCall", "tool");

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final List<ToolCallExtractionStrategy> strategies;

    public ToolCallNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        List<ToolCallExtractionStrategy> shapes = List.of(new NestedFunctionShape(), new FlatShape());
        List<ToolCallExtractionStrategy> ordered = new ArrayList<>();
        ordered.add(new WrappedShape(shapes));
        ordered.addAll(shapes);
        this.strategies = List.copyOf(ordered);
    }

    /**
     * True when the node carries an array of tool calls in one of the known keys.
     */
    public boolean hasToolCallArray(JsonNode node) {
        if (node == null || !node.isObject()) {
            return false;
        }
        return ARRAY_KEYS.stream().anyMatch(key -> node.path(key).isArray())
                || node.path("toolWithToolCallList").isArray();
    }

    /**
     * Every tool call carried by an event or webhook message, in order, without duplicates by id.
     */
    public List<ToolCall> normalizeAll(JsonNode node) {
        List<ToolCall> calls = new ArrayList<>();
        Set<String> seenIds = new LinkedHashSet<>();
        for (JsonNode candidate : candidates(node)) {
            normalize(candidate).ifPresent(call -> {
                if (seenIds.add(call.getId())) {
                    calls.add(call);
                }
            });
        }
        return calls;
    }

    public Optional<ToolCall> normalize(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        for (ToolCallExtractionStrategy strategy : strategies) {
            Optional<ToolCall> call = strategy.extract(node);
            if (call.isPresent()) {
                return call.map(this::canonicalize);
            }
        }
        log.warn("Unrecognized tool call shape: {}", abbreviate(node));
        return Optional.empty();
    }

    private List<JsonNode> candidates(JsonNode node) {
        List<JsonNode> candidates = new ArrayList<>();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return candidates;
        }
        if (node.isArray()) {
            node.forEach(candidates::add);
            return candidates;
        }
        for (String key : ARRAY_KEYS) {
            if (node.path(key).isArray()) {
                node.path(key).forEach(candidates::add);
                return candidates;
            }
        }
        if (node.path("toolWithToolCallList").isArray()) {
            for (JsonNode item : node.path("toolWithToolCallList")) {
                candidates.add(item.path("toolCall").isObject() ? item.path("toolCall") : item);
            }
            return candidates;
        }
        candidates.add(node);
        return candidates;
    }

    private ToolCall canonicalize(ToolCall call) {
        String name = ToolName.fromName(call.getName())
                .map(ToolName::getCanonicalName)
                .orElse(call.getName().trim());
        return ToolCall.builder()
                .id(call.getId().trim())
                .name(name)
                .args(call.getArgs())
                .build();
    }

    Map<String, Object> parseArguments(JsonNode value, String toolName) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return new LinkedHashMap<>();
        }
        JsonNode parsed = value;
        if (value.isTextual()) {
            String text = value.asText().trim();
            if (text.isEmpty()) {
                return new LinkedHashMap<>();
            }
            try {
                parsed = objectMapper.readTree(text);
            } catch (JsonProcessingException e) {
                log.warn("Failed to parse arguments for tool {}: {}", toolName, e.getOriginalMessage());
                return new LinkedHashMap<>();
            }
        }
        if (parsed == null || !parsed.isObject()) {
            return new LinkedHashMap<>();
        }
        return objectMapper.convertValue(parsed, MAP_TYPE);
    }

    static String firstText(JsonNode node, List<String> keys) {
        for (String key : keys) {
            JsonNode value = node.path(key);
            if (value.isValueNode() && !value.isNull()) {
                String text = value.asText().trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return null;
    }

    static JsonNode firstPresent(JsonNode node, List<String> keys) {
        for (String key : keys) {
            JsonNode value = node.path(key);
            if (!value.isMissingNode() && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private static String abbreviate(JsonNode node) {
        String text = node.toString();
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }

    /**
     * {@code {"tool_call": {...}}}, {@code {"toolCall": {...}}} or {@code {"tool": {...}}}.
     */
    private static final class WrappedShape implements ToolCallExtractionStrategy {
        private final List<ToolCallExtractionStrategy> inner;

        private WrappedShape(List<ToolCallExtractionStrategy> inner) {
            this.inner = inner;
        }

        @Override
        public Optional<ToolCall> extract(JsonNode node) {
            for (String key : WRAPPER_KEYS) {
                JsonNode container = node.path(key);
                if (container.isObject()) {
                    for (ToolCallExtractionStrategy strategy : inner) {
                        Optional<ToolCall> call = strategy.extract(container);
                        if (call.isPresent()) {
                            return call;
                        }
                    }
                }
            }
            return Optional.empty();
        }
    }

    /**
     * {@code {"id": ..., "function": {"name": ..., "arguments": ...}}}.
     */
    private final class NestedFunctionShape implements ToolCallExtractionStrategy {
        @Override
        public Optional<ToolCall> extract(JsonNode node) {
            JsonNode function = node.path("function");
            if (!function.isObject()) {
                return Optional.empty();
            }
            String id = firstText(node, ID_KEYS);
            if (id == null) {
                id = firstText(function, ID_KEYS);
            }
            String name = firstText(function, List.of("name"));
            if (name == null) {
                name = firstText(node, NAME_KEYS);
            }
            if (id == null || name == null) {
                return Optional.empty();
            }
            JsonNode arguments = function.has("arguments") ? function.get("arguments") : firstPresent(node, ARGUMENT_KEYS);
            return Optional.of(ToolCall.builder()
                    .id(id)
                    .name(name)
                    .args(parseArguments(arguments, name))
                    .build());
        }
    }

    /**
     * {@code {"id": ..., "name": ..., "arguments": ...}} with any of the accepted key spellings.
     */
    private final class FlatShape implements ToolCallExtractionStrategy {
        @Override
        public Optional<ToolCall> extract(JsonNode node) {
            String id = firstText(node, ID_KEYS);
            String name = firstText(node, NAME_KEYS);
            if (id == null || name == null) {
                return Optional.empty();
            }
            return Optional.of(ToolCall.builder()
                    .id(id)
                    .name(name)
                    .args(parseArguments(firstPresent(node, ARGUMENT_KEYS), name))
                    .build());
        }
    }
}
