package com.call_bridge_backend.services.tools;

import com.call_bridge_backend.dto.ToolCall;
import com.call_bridge_backend.dto.ToolResponse;
import com.call_bridge_backend.dto.ToolResult;
import com.call_bridge_backend.exceptions.CallBridgeExceptionHandler.ToolArgumentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes a normalized tool call to its handler. Never throws: every outcome is a {@link ToolResponse}
 * carrying the id of the call it answers.
 */
@Service
@Slf4j
public class ToolCallDispatcher {

    static final String CALENDAR_UNAVAILABLE = "Calendar integration not available";

    private final Map<ToolName, ToolHandler> handlers = new EnumMap<>(ToolName.class);

    public ToolCallDispatcher(List<ToolHandler> toolHandlers) {
        for (ToolHandler handler : toolHandlers) {
            ToolHandler previous = handlers.put(handler.getToolName(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for tool " + handler.getToolName().getCanonicalName());
            }
        }
        log.info("Registered tool handlers: {}", handlers.keySet());
    }

    public ToolResponse dispatch(ToolCall call, ToolCallContext context) {
        return new ToolResponse(call.getId(), execute(call, context));
    }

    private ToolResult execute(ToolCall call, ToolCallContext context) {
        String callId = context.getCallId();
        Optional<ToolName> toolName = ToolName.fromName(call.getName());
        if (toolName.isEmpty()) {
            log.warn("[{}] Unknown tool requested: {}", callId, call.getName());
            return ToolResult.failure("Unknown tool: " + call.getName());
        }

        ToolName tool = toolName.get();
        if (tool.isCalendarTool() && !context.isCalendarEnabled()) {
            log.warn("[{}] Tool {} ignored because calendar integration is disabled", callId, tool.getCanonicalName());
            return ToolResult.failure(CALENDAR_UNAVAILABLE);
        }

        ToolHandler handler = handlers.get(tool);
        if (handler == null) {
            log.error("[{}] No handler registered for tool {}", callId, tool.getCanonicalName());
            return ToolResult.failure("Tool not available: " + tool.getCanonicalName());
        }

        log.info("[{}] Executing tool {} ({})", callId, tool.getCanonicalName(), call.getId());
        try {
            ToolResult result = handler.handle(call, context);
            log.info("[{}] Tool {} finished (success: {})", callId, tool.getCanonicalName(), result.isSuccess());
            return result;
        } catch (ToolArgumentException e) {
            log.warn("[{}] Invalid arguments for tool {}: {}", callId, tool.getCanonicalName(), e.getMessage());
            return ToolResult.failure(e.getMessage(), Map.of("fields", e.getFields()));
        } catch (RuntimeException e) {
            log.error("[{}] Tool {} failed", callId, tool.getCanonicalName(), e);
            String message = e.getMessage() == null || e.getMessage().isBlank()
                    ? "Tool execution failed"
                    : e.getMessage();
            return ToolResult.failure(message, Map.of("tool", tool.getCanonicalName()));
        }
    }
}
