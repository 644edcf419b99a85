package com.call_bridge_backend.services.tools;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Tools the assistant can call, with the legacy names older assistants still send.
 */
public enum ToolName {
    TRANSFER_CALL("transfer_call", false, "transferCall"),
    CHECK_CALENDAR_AVAILABILITY("check_calendar_availability", true, "check_google_calendar_availability"),
    CREATE_CALENDAR_EVENT("create_calendar_event", true, "schedule_google_calendar_event"),
    CANCEL_CALENDAR_EVENT("cancel_calendar_event", true, "cancel_google_calendar_event");

    private final String canonicalName;
    private final boolean calendarTool;
    private final List<String> aliases;

    ToolName(String canonicalName, boolean calendarTool, String... aliases) {
        this.canonicalName = canonicalName;
        this.calendarTool = calendarTool;
        this.aliases = List.of(aliases);
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    public boolean isCalendarTool() {
        return calendarTool;
    }

    public static Optional<ToolName> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(tool -> tool.canonicalName.equals(trimmed) || tool.aliases.contains(trimmed))
                .findFirst();
    }
}
