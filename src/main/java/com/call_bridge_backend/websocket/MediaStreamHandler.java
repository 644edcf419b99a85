package com.call_bridge_backend.websocket;

import com.call_bridge_backend.config.VoiceConfig;
import com.call_bridge_backend.services.CallSession;
import com.call_bridge_backend.services.CallSessionFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Carrier media-stream socket. Frames received before {@code start} are buffered; the first
 * {@code start} creates the call's {@link CallSession} and the buffered frames are replayed to it.
 * Later {@code start} events on the same socket are ignored.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MediaStreamHandler extends TextWebSocketHandler {

    private static final int SEND_TIME_LIMIT_MS = 5000;
    private static final int SEND_BUFFER_LIMIT_BYTES = 512 * 1024;

    private final CallSessionFactory callSessionFactory;
    private final VoiceConfig voiceConfig;
    private final ObjectMapper objectMapper;

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        Object destination = session.getAttributes().get(DestinationNumberHandshakeInterceptor.DESTINATION_ATTRIBUTE);
        if (destination == null) {
            log.warn("Media stream {} opened without destination number, closing", session.getId());
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        WebSocketSession carrier = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES);
        connections.put(session.getId(), new Connection(carrier, destination.toString()));
        log.info("Media stream {} connected for {}", session.getId(), destination);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Connection connection = connections.get(session.getId());
        if (connection == null) {
            return;
        }

        JsonNode frame;
        try {
            frame = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.warn("Media stream {}: dropping malformed frame: {}", session.getId(), e.getOriginalMessage());
            return;
        }
        if (frame == null || !frame.isObject()) {
            log.warn("Media stream {}: dropping frame that is not a JSON object", session.getId());
            return;
        }

        String event = frame.path("event").asText("");
        CallSession callSession = connection.callSession;
        if (callSession != null) {
            if ("start".equals(event)) {
                log.warn("[{}] Ignoring duplicate start event", callSession.getCallId());
                return;
            }
            dispatch(callSession, event, frame);
            return;
        }

        if ("start".equals(event)) {
            startCall(session, connection, frame);
        } else {
            connection.buffer(frame, voiceConfig.getMaxBufferedFrames());
        }
    }

    private void startCall(WebSocketSession session, Connection connection, JsonNode frame) {
        JsonNode start = frame.path("start");
        String callId = firstText(start.path("callSid"), start.path("callId"), frame.path("callSid"));
        String streamId = firstText(start.path("streamSid"), start.path("streamId"), frame.path("streamSid"));
        if (callId == null) {
            log.warn("Media stream {}: start event without call id, dropping", session.getId());
            return;
        }

        String connectionId = session.getId();
        CallSession callSession = callSessionFactory.create(connection.carrier, callId, streamId,
                connection.destinationNumber, () -> connections.remove(connectionId));
        connection.callSession = callSession;
        log.info("[{}] Media stream started (stream {})", callId, streamId);
        callSession.start();

        for (JsonNode buffered : connection.drain()) {
            dispatch(callSession, buffered.path("event").asText(""), buffered);
        }
    }

    private void dispatch(CallSession callSession, String event, JsonNode frame) {
        switch (event) {
            case "media":
                String payload = frame.path("media").path("payload").asText(null);
                if (payload == null) {
                    log.warn("[{}] Media frame without payload", callSession.getCallId());
                    return;
                }
                byte[] audio;
                try {
                    audio = Base64.getDecoder().decode(payload);
                } catch (IllegalArgumentException e) {
                    log.warn("[{}] Dropping media frame with invalid base64", callSession.getCallId());
                    return;
                }
                callSession.onCarrierMedia(audio);
                break;
            case "mark":
                callSession.onCarrierMark(frame.path("mark").path("name").asText(null));
                break;
            case "stop":
                callSession.teardown("carrier stop");
                break;
            case "connected":
                log.debug("[{}] Carrier connected event", callSession.getCallId());
                break;
            default:
                log.debug("[{}] Ignoring carrier event '{}'", callSession.getCallId(), event);
                break;
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("Media stream {} transport error: {}", session.getId(), exception.getMessage());
        closeConnection(session, "carrier transport error");
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("Media stream {} closed: {}", session.getId(), status);
        closeConnection(session, "carrier socket closed");
    }

    int activeConnections() {
        return connections.size();
    }

    private void closeConnection(WebSocketSession session, String reason) {
        Connection connection = connections.remove(session.getId());
        if (connection != null && connection.callSession != null) {
            connection.callSession.teardown(reason);
        }
    }

    private static String firstText(JsonNode... candidates) {
        for (JsonNode candidate : candidates) {
            if (candidate.isTextual() && !candidate.asText().isBlank()) {
                return candidate.asText().trim();
            }
        }
        return null;
    }

    private static final class Connection {
        private final WebSocketSession carrier;
        private final String destinationNumber;
        private final Deque<JsonNode> pending = new ArrayDeque<>();
        private volatile CallSession callSession;

        private Connection(WebSocketSession carrier, String destinationNumber) {
            this.carrier = carrier;
            this.destinationNumber = destinationNumber;
        }

        private synchronized void buffer(JsonNode frame, int limit) {
            if (limit <= 0) {
                return;
            }
            while (pending.size() >= limit) {
                pending.pollFirst();
            }
            pending.addLast(frame);
        }

        private synchronized List<JsonNode> drain() {
            List<JsonNode> frames = new ArrayList<>(pending);
            pending.clear();
            return frames;
        }
    }
}
