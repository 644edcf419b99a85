package com.call_bridge_backend.services.realtime;

import com.call_bridge_backend.dto.ToolCall;
import org.springframework.web.socket.CloseStatus;

import java.util.List;

/**
 * Callbacks from one realtime socket to the call that owns it.
 */
public interface RealtimeSessionListener {

    void onAudio(byte[] audio);

    default void onText(String text) {
    }

    void onTurnCompleted();

    void onToolCalls(List<ToolCall> toolCalls);

    /**
     * An {@code error} event from the provider. The socket stays open.
     */
    void onProviderError(String message);

    void onTransportError(Throwable error);

    void onClosed(CloseStatus status);
}
