package com.call_bridge_backend.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A tool call from the AI session, normalized to one shape regardless of the wire format.
 */
@Value
@Builder
public class ToolCall {
    String id;
    String name;
    Map<String, Object> args;

    public String stringArg(String... keys) {
        for (String key : keys) {
            Object value = args.get(key);
            if (value != null) {
                String text = value.toString().trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return null;
    }
}
