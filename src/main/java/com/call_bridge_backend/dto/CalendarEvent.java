package com.call_bridge_backend.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CalendarEvent {
    String summary;
    String location;
    String description;
    String start;
    String end;
    String timeZone;
    @Singular
    List<Attendee> attendees;

    @Value
    public static class Attendee {
        String email;
        String displayName;
    }
}
