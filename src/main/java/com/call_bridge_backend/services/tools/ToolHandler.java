package com.call_bridge_backend.services.tools;

import com.call_bridge_backend.dto.ToolCall;
import com.call_bridge_backend.dto.ToolResult;

public interface ToolHandler {

    ToolName getToolName();

    /**
     * Validate the arguments and run the tool. Missing or invalid arguments are reported with
     * {@link com.call_bridge_backend.exceptions.CallBridgeExceptionHandler.ToolArgumentException}.
     */
    ToolResult handle(ToolCall call, ToolCallContext context);
}
