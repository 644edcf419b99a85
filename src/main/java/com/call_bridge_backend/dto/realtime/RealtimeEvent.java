package com.call_bridge_backend.dto.realtime;

import com.call_bridge_backend.dto.ToolCall;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One inbound frame from the realtime socket after normalization.
 */
@Value
@Builder
public class RealtimeEvent {

    public enum Kind {
        AUDIO,
        TEXT,
        TURN_COMPLETED,
        TOOL_CALLS,
        ERROR,
        IGNORED
    }

    Kind kind;
    String type;
    byte[] audio;
    String text;
    @Singular
    List<ToolCall> toolCalls;
    String error;

    public static RealtimeEvent ignored(String type) {
        return RealtimeEvent.builder().kind(Kind.IGNORED).type(type).build();
    }
}
