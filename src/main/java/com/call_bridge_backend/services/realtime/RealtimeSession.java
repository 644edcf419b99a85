package com.call_bridge_backend.services.realtime;

import com.call_bridge_backend.dto.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One outbound socket to the provider, owned by a single call. Sends are no-ops once closed.
 */
@Slf4j
public class RealtimeSession {

    private final String callId;
    private final String aiCallId;
    private final WebSocketSession socket;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RealtimeSession(String callId, String aiCallId, WebSocketSession socket, ObjectMapper objectMapper) {
        this.callId = callId;
        this.aiCallId = aiCallId;
        this.socket = socket;
        this.objectMapper = objectMapper;
    }

    public String getAiCallId() {
        return aiCallId;
    }

    WebSocketSession getSocket() {
        return socket;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Raw companded audio exactly as received from the carrier.
     */
    public void sendAudio(byte[] audio) throws IOException {
        if (closed.get()) {
            return;
        }
        socket.sendMessage(new BinaryMessage(ByteBuffer.wrap(audio)));
    }

    /**
     * Mark the end of the caller's turn and ask for a response.
     */
    public void commitUserAudio() throws IOException {
        if (closed.get()) {
            return;
        }
        log.debug("[{}] Committing user audio", callId);
        sendJson(Map.of("type", "input_audio_buffer.commit"));
        sendJson(Map.of("type", "response.create", "response", Map.of()));
    }

    public void sendToolResponse(String toolCallId, ToolResult result) throws IOException {
        if (closed.get()) {
            return;
        }
        Map<String, Object> toolResponse = new LinkedHashMap<>();
        toolResponse.put("tool_call_id", toolCallId);
        toolResponse.put("output", objectMapper.writeValueAsString(result));

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("type", "tool.response.create");
        event.put("tool_response", toolResponse);
        sendJson(event);
    }

    public void ping() throws IOException {
        if (closed.get()) {
            return;
        }
        socket.sendMessage(new PingMessage(ByteBuffer.wrap(new byte[]{1})));
    }

    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            if (socket.isOpen()) {
                socket.close(CloseStatus.NORMAL);
            }
        } catch (IOException e) {
            log.warn("[{}] Failed to close realtime socket: {}", callId, e.getMessage());
        }
    }

    private void sendJson(Map<String, Object> event) throws IOException {
        socket.sendMessage(new TextMessage(objectMapper.writeValueAsString(event)));
    }
}
