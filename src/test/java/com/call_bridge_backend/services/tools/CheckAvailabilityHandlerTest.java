package com.call_bridge_backend.services.tools;

import com.call_bridge_backend.config.VoiceConfig;
import com.call_bridge_backend.dto.ToolCall;
import com.call_bridge_backend.dto.ToolResult;
import com.call_bridge_backend.exceptions.CallBridgeExceptionHandler.ToolArgumentException;
import com.call_bridge_backend.models.BusinessConfig;
import com.call_bridge_backend.services.SchedulingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CheckAvailabilityHandlerTest {

    // 2026-10-20 is a Tuesday
    private static final LocalDate TUESDAY = LocalDate.of(2026, 10, 20);

    @Mock
    private ObjectProvider<SchedulingService> provider;
    @Mock
    private SchedulingService schedulingService;

    private CheckAvailabilityHandler handler;

    @BeforeEach
    void setUp() {
        handler = new CheckAvailabilityHandler(provider, new VoiceConfig());
    }

    @Test
    void shouldUseBusinessOpeningHours() {
        when(provider.getIfAvailable()).thenReturn(schedulingService);
        when(schedulingService.getAvailableSlots(7L, TUESDAY, 8, 12)).thenReturn(List.of("08:00", "11:30"));
        BusinessConfig business = BusinessConfig.builder()
                .companyId(7L)
                .calendarEnabled(true)
                .openingHour(BusinessConfig.OpeningHour.builder().dayOfWeek(2).open(true).openTime("08:00").closeTime("12:00").build())
                .build();

        ToolResult result = handler.handle(call("2026-10-20"), context(business));

        assertThat(result.isSuccess()).isTrue();
        assertThat(data(result))
                .containsEntry("date", "2026-10-20")
                .containsEntry("openHour", 8)
                .containsEntry("closeHour", 12)
                .containsEntry("slots", List.of("08:00", "11:30"))
                .containsEntry("summary", "I have the following times available: eight o'clock, half past eleven.");
    }

    @Test
    void shouldFallBackToDefaultHoursWhenDayIsClosedOrUnknown() {
        when(provider.getIfAvailable()).thenReturn(schedulingService);
        when(schedulingService.getAvailableSlots(7L, TUESDAY, 9, 17)).thenReturn(List.of());
        BusinessConfig business = BusinessConfig.builder()
                .companyId(7L)
                .openingHour(BusinessConfig.OpeningHour.builder().dayOfWeek(2).open(false).build())
                .build();

        ToolResult result = handler.handle(call("2026-10-20"), context(business));

        assertThat(data(result))
                .containsEntry("openHour", 9)
                .containsEntry("closeHour", 17)
                .containsEntry("summary", "There are no available times on this day.");
    }

    @Test
    void shouldRejectMissingOrMalformedDate() {
        assertThatThrownBy(() -> handler.handle(ToolCall.builder().id("tc").name("check_calendar_availability").args(Map.of()).build(), context(null)))
                .isInstanceOf(ToolArgumentException.class)
                .hasMessageContaining("date");
        assertThatThrownBy(() -> handler.handle(call("20-10-2026"), context(null)))
                .isInstanceOf(ToolArgumentException.class)
                .hasMessageContaining("YYYY-MM-DD");
    }

    @Test
    void shouldFailWhenSchedulingIsNotConfigured() {
        when(provider.getIfAvailable()).thenReturn(null);

        ToolResult result = handler.handle(call("2026-10-20"), context(null));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("Scheduling is not configured");
    }

    private static ToolCall call(String date) {
        return ToolCall.builder().id("tc").name("check_calendar_availability").args(Map.of("date", date)).build();
    }

    private static ToolCallContext context(BusinessConfig business) {
        return ToolCallContext.builder().callId("CA1").business(business).build();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> data(ToolResult result) {
        return (Map<String, Object>) result.getData();
    }
}
