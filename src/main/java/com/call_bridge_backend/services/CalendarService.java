package com.call_bridge_backend.services;

import com.call_bridge_backend.dto.CalendarEvent;
import com.call_bridge_backend.dto.CancelEventRequest;

public interface CalendarService {

    Object createEvent(Long companyId, CalendarEvent event);

    boolean cancelEvent(Long companyId, CancelEventRequest request);
}
