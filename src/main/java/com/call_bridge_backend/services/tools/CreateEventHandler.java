package com.call_bridge_backend.services.tools;

import com.call_bridge_backend.config.VoiceConfig;
import com.call_bridge_backend.dto.CalendarEvent;
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

@Component
@Slf4j
@RequiredArgsConstructor
public class CreateEventHandler implements ToolHandler {

    private static final List<String> REQUIRED = List.of("summary", "start", "end", "name", "dateOfBirth");

    private final ObjectProvider<CalendarService> calendarService;
    private final VoiceConfig voiceConfig;

    @Override
    public ToolName getToolName() {
        return ToolName.CREATE_CALENDAR_EVENT;
    }

    @Override
    public ToolResult handle(ToolCall call, ToolCallContext context) {
        List<String> missing = new ArrayList<>();
        for (String field : REQUIRED) {
            if (call.stringArg(field) == null) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            throw new ToolArgumentException("Missing required arguments: " + String.join(", ", missing), missing);
        }

        CalendarService service = calendarService.getIfAvailable();
        if (service == null) {
            return ToolResult.failure("Calendar service is not configured");
        }

        String name = call.stringArg("name");
        String dateOfBirth = call.stringArg("dateOfBirth");
        String extra = call.stringArg("description");
        String description = "Appointment for " + name + " (DOB: " + dateOfBirth + ")." + (extra == null ? "" : " " + extra);

        CalendarEvent.CalendarEventBuilder event = CalendarEvent.builder()
                .summary(call.stringArg("summary"))
                .location(call.stringArg("location"))
                .description(description)
                .start(call.stringArg("start"))
                .end(call.stringArg("end"))
                .timeZone(voiceConfig.getTimeZone());
        String attendeeEmail = call.stringArg("attendeeEmail");
        if (attendeeEmail != null) {
            event.attendee(new CalendarEvent.Attendee(attendeeEmail, name));
        }

        Object created = service.createEvent(context.getCompanyId(), event.build());
        log.info("[{}] Created calendar event '{}'", context.getCallId(), call.stringArg("summary"));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("event", created);
        return ToolResult.success(data);
    }
}
