package com.call_bridge_backend.services.tools;

import com.call_bridge_backend.dto.CancelEventRequest;
import com.call_bridge_backend.dto.ToolCall;
import com.call_bridge_backend.dto.ToolResult;
import com.call_bridge_backend.exceptions.CallBridgeExceptionHandler.ToolArgumentException;
import com.call_bridge_backend.services.CalendarService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cancels by event id, or by the caller's name, date of birth and appointment date.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CancelEventHandler implements ToolHandler {

    private final ObjectProvider<CalendarService> calendarService;

    @Override
    public ToolName getToolName() {
        return ToolName.CANCEL_CALENDAR_EVENT;
    }

    @Override
    public ToolResult handle(ToolCall call, ToolCallContext context) {
        String eventId = call.stringArg("eventId", "event_id");
        String name = call.stringArg("name");
        String dateOfBirth = call.stringArg("dateOfBirth");
        String date = call.stringArg("date");

        if (eventId == null) {
            List<String> missing = new ArrayList<>();
            if (name == null) {
                missing.add("name");
            }
            if (dateOfBirth == null) {
                missing.add("dateOfBirth");
            }
            if (date == null) {
                missing.add("date");
            }
            if (!missing.isEmpty()) {
                throw new ToolArgumentException(
                        "Either eventId or name, dateOfBirth and date are required. Missing: " + String.join(", ", missing),
                        missing);
            }
        }

        CalendarService service = calendarService.getIfAvailable();
        if (service == null) {
            return ToolResult.failure("Calendar service is not configured");
        }

        CancelEventRequest request = CancelEventRequest.builder()
                .eventId(eventId)
                .name(name)
                .dateOfBirth(dateOfBirth)
                .date(date)
                .build();
        boolean cancelled = service.cancelEvent(context.getCompanyId(), request);
        log.info("[{}] Cancel appointment request handled (cancelled: {})", context.getCallId(), cancelled);

        if (!cancelled) {
            return ToolResult.failure("No matching appointment found");
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("cancelled", true);
        if (eventId != null) {
            data.put("eventId", eventId);
        }
        return ToolResult.success(data);
    }
}
