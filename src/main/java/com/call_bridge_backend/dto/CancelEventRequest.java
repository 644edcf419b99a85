package com.call_bridge_backend.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Identifies an appointment either by event id or by the caller's name, date of birth and appointment date.
 */
@Value
@Builder
public class CancelEventRequest {
    String eventId;
    String name;
    String dateOfBirth;
    String date;
}
