package com.call_bridge_backend.services.tools;

import com.call_bridge_backend.config.VoiceConfig;
import com.call_bridge_backend.dto.ToolCall;
import com.call_bridge_backend.dto.ToolResult;
import com.call_bridge_backend.exceptions.CallBridgeExceptionHandler.ToolArgumentException;
import com.call_bridge_backend.models.BusinessConfig;
import com.call_bridge_backend.services.SchedulingService;
import com.call_bridge_backend.utils.SlotSummarizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
@RequiredArgsConstructor
public class CheckAvailabilityHandler implements ToolHandler {

    private final ObjectProvider<SchedulingService> schedulingService;
    private final VoiceConfig voiceConfig;

    @Override
    public ToolName getToolName() {
        return ToolName.CHECK_CALENDAR_AVAILABILITY;
    }

    @Override
    public ToolResult handle(ToolCall call, ToolCallContext context) {
        String rawDate = call.stringArg("date");
        if (rawDate == null) {
            throw new ToolArgumentException("Missing required argument: date", List.of("date"));
        }
        LocalDate date;
        try {
            date = LocalDate.parse(rawDate);
        } catch (DateTimeParseException e) {
            throw new ToolArgumentException("Invalid date, expected YYYY-MM-DD: " + rawDate, List.of("date"));
        }

        SchedulingService service = schedulingService.getIfAvailable();
        if (service == null) {
            return ToolResult.failure("Scheduling is not configured");
        }

        int openHour = voiceConfig.getDefaultOpenHour();
        int closeHour = voiceConfig.getDefaultCloseHour();
        Optional<BusinessConfig.OpeningHour> hours = context.getBusiness() == null
                ? Optional.empty()
                : context.getBusiness().openingHourFor(date.getDayOfWeek().getValue());
        if (hours.isPresent() && hours.get().isOpen()) {
            Integer open = parseHour(hours.get().getOpenTime());
            Integer close = parseHour(hours.get().getCloseTime());
            if (open != null && close != null && open < close) {
                openHour = open;
                closeHour = close;
            }
        }

        List<String> slots = service.getAvailableSlots(context.getCompanyId(), date, openHour, closeHour);
        log.info("[{}] {} free slots on {} between {}:00 and {}:00", context.getCallId(), slots.size(), date, openHour, closeHour);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("date", date.toString());
        data.put("openHour", openHour);
        data.put("closeHour", closeHour);
        data.put("slots", slots);
        data.put("summary", SlotSummarizer.summarize(slots, openHour, closeHour));
        return ToolResult.success(data);
    }

    private static Integer parseHour(String time) {
        if (time == null || time.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(time.trim().split(":")[0]);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
