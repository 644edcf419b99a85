package com.call_bridge_backend.dto;

import lombok.Value;

/**
 * A tool result paired with the id of the call it answers.
 */
@Value
public class ToolResponse {
    String toolCallId;
    ToolResult result;
}
