package com.call_bridge_backend.services;

import java.time.LocalDate;
import java.util.List;

public interface SchedulingService {

    /**
     * Free half-hour slots ("HH:mm") on the given date between the opening and closing hour.
     */
    List<String> getAvailableSlots(Long companyId, LocalDate date, int openHour, int closeHour);
}
