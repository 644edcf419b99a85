package com.call_bridge_backend.services.realtime;

import com.call_bridge_backend.dto.realtime.RealtimeEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Socket handler for one realtime connection. Frames are normalized and handed to the owning call.
 */
@Slf4j
public class RealtimeEventHandler extends AbstractWebSocketHandler {

    private final String callId;
    private final RealtimeEventNormalizer normalizer;
    private final RealtimeSessionListener listener;
    private final AtomicBoolean established = new AtomicBoolean(false);

    public RealtimeEventHandler(String callId, RealtimeEventNormalizer normalizer, RealtimeSessionListener listener) {
        this.callId = callId;
        this.normalizer = normalizer;
        this.listener = listener;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        established.set(true);
        log.info("[{}] Realtime socket connected: {}", callId, session.getUri());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        dispatch(normalizer.fromText(message.getPayload()));
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        dispatch(normalizer.fromBinary(message.getPayload()));
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        log.trace("[{}] Realtime pong", callId);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("[{}] Realtime socket transport error: {}", callId, exception.getMessage());
        log.debug("[{}] Full transport error:", callId, exception);
        if (established.get()) {
            listener.onTransportError(exception);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("[{}] Realtime socket closed: {} - {}", callId, status.getCode(), status.getReason());
        if (established.getAndSet(false)) {
            listener.onClosed(status);
        }
    }

    private void dispatch(RealtimeEvent event) {
        switch (event.getKind()) {
            case AUDIO:
                listener.onAudio(event.getAudio());
                break;
            case TEXT:
                listener.onText(event.getText());
                break;
            case TURN_COMPLETED:
                listener.onTurnCompleted();
                break;
            case TOOL_CALLS:
                listener.onToolCalls(event.getToolCalls());
                break;
            case ERROR:
                listener.onProviderError(event.getError());
                break;
            default:
                break;
        }
    }
}
