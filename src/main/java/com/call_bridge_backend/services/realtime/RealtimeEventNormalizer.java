package com.call_bridge_backend.services.realtime;

import com.call_bridge_backend.dto.realtime.RealtimeEvent;
import com.call_bridge_backend.dto.realtime.RealtimeEvent.Kind;
import com.call_bridge_backend.services.tools.ToolCallNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.util.Base64;
import java.util.Set;

/**
 * Classifies inbound realtime frames. Binary frames are audio; JSON frames are discriminated by
 * {@code type}. Unknown or malformed frames come back as {@link Kind#IGNORED}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RealtimeEventNormalizer {

    private static final Set<String> TOOL_CALL_TYPES = Set.of(
            "response.tool_call", "tool.call", "session.tool_call", "tool-calls", "function_call");

    private final ObjectMapper objectMapper;
    private final ToolCallNormalizer toolCallNormalizer;

    public RealtimeEvent fromBinary(ByteBuffer payload) {
        byte[] audio = new byte[payload.remaining()];
        payload.get(audio);
        return RealtimeEvent.builder().kind(Kind.AUDIO).type("binary").audio(audio).build();
    }

    public RealtimeEvent fromText(String payload) {
        JsonNode event;
        try {
            event = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("Dropping malformed realtime frame: {}", e.getOriginalMessage());
            return RealtimeEvent.ignored(null);
        }
        if (event == null || !event.isObject()) {
            log.warn("Dropping realtime frame that is not a JSON object");
            return RealtimeEvent.ignored(null);
        }
        return fromJson(event);
    }

    public RealtimeEvent fromJson(JsonNode event) {
        String type = event.path("type").asText("");

        switch (type) {
            case "response.audio.delta":
                return audioDelta(type, event);
            case "response.output_text.delta":
                return text(type, firstText(event.path("text"), event.path("delta")));
            case "response.message.delta":
                return text(type, firstText(event.path("delta").path("text"), event.path("message").path("content"),
                        event.path("message").path("text")));
            case "transcript":
                return text(type, firstText(event.path("transcript"), event.path("text")));
            case "response.completed":
            case "response.done":
                return RealtimeEvent.builder().kind(Kind.TURN_COMPLETED).type(type).build();
            case "error":
                return RealtimeEvent.builder().kind(Kind.ERROR).type(type).error(errorMessage(event)).build();
            default:
                break;
        }

        if (TOOL_CALL_TYPES.contains(type) || toolCallNormalizer.hasToolCallArray(event)) {
            RealtimeEvent.RealtimeEventBuilder builder = RealtimeEvent.builder().kind(Kind.TOOL_CALLS).type(type);
            toolCallNormalizer.normalizeAll(event).forEach(builder::toolCall);
            RealtimeEvent toolEvent = builder.build();
            if (toolEvent.getToolCalls().isEmpty()) {
                log.warn("Tool call event {} carried no usable tool call", type);
                return RealtimeEvent.ignored(type);
            }
            return toolEvent;
        }

        log.debug("Ignoring realtime event {}", type);
        return RealtimeEvent.ignored(type);
    }

    private RealtimeEvent audioDelta(String type, JsonNode event) {
        String encoded = firstText(event.path("audio"), event.path("delta"), event.path("data"));
        if (encoded == null) {
            return RealtimeEvent.ignored(type);
        }
        try {
            byte[] audio = Base64.getDecoder().decode(encoded);
            return RealtimeEvent.builder().kind(Kind.AUDIO).type(type).audio(audio).build();
        } catch (IllegalArgumentException e) {
            log.warn("Dropping audio delta with invalid base64: {}", e.getMessage());
            return RealtimeEvent.ignored(type);
        }
    }

    private static RealtimeEvent text(String type, String text) {
        if (text == null) {
            return RealtimeEvent.ignored(type);
        }
        return RealtimeEvent.builder().kind(Kind.TEXT).type(type).text(text).build();
    }

    private static String errorMessage(JsonNode event) {
        String message = firstText(event.path("error").path("message"), event.path("message"), event.path("error"));
        return message != null ? message : "Unknown realtime error";
    }

    private static String firstText(JsonNode... candidates) {
        for (JsonNode candidate : candidates) {
            if (candidate.isTextual() && !candidate.asText().isEmpty()) {
                return candidate.asText();
            }
        }
        return null;
    }
}
