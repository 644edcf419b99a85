package com.call_bridge_backend.services.tools;

import com.call_bridge_backend.dto.CancelEventRequest;
import com.call_bridge_backend.dto.ToolCall;
import com.call_bridge_backend.dto.ToolResult;
import com.call_bridge_backend.exceptions.CallBridgeExceptionHandler.ToolArgumentException;
import com.call_bridge_backend.models.BusinessConfig;
import com.call_bridge_backend.services.CalendarService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CancelEventHandlerTest {

    @Mock
    private ObjectProvider<CalendarService> provider;
    @Mock
    private CalendarService calendarService;

    private CancelEventHandler handler;
    private ToolCallContext context;

    @BeforeEach
    void setUp() {
        handler = new CancelEventHandler(provider);
        context = ToolCallContext.builder()
                .callId("CA1")
                .business(BusinessConfig.builder().companyId(7L).calendarEnabled(true).build())
                .build();
    }

    @Test
    void shouldCancelByEventId() {
        when(provider.getIfAvailable()).thenReturn(calendarService);
        when(calendarService.cancelEvent(eq(7L), any())).thenReturn(true);

        ToolResult result = handler.handle(call(Map.of("eventId", "evt_1")), context);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getData()).isEqualTo(Map.of("cancelled", true, "eventId", "evt_1"));
    }

    @Test
    void shouldCancelByCallerDetails() {
        when(provider.getIfAvailable()).thenReturn(calendarService);
        when(calendarService.cancelEvent(eq(7L), any())).thenReturn(true);

        handler.handle(call(Map.of("name", "Jane Doe", "dateOfBirth", "1990-01-31", "date", "2026-10-20")), context);

        ArgumentCaptor<CancelEventRequest> request = ArgumentCaptor.forClass(CancelEventRequest.class);
        verify(calendarService).cancelEvent(eq(7L), request.capture());
        assertThat(request.getValue().getEventId()).isNull();
        assertThat(request.getValue().getName()).isEqualTo("Jane Doe");
        assertThat(request.getValue().getDate()).isEqualTo("2026-10-20");
    }

    @Test
    void shouldReportNoMatch() {
        when(provider.getIfAvailable()).thenReturn(calendarService);
        when(calendarService.cancelEvent(eq(7L), any())).thenReturn(false);

        ToolResult result = handler.handle(call(Map.of("eventId", "evt_missing")), context);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("No matching appointment found");
    }

    @Test
    void shouldRequireEventIdOrCallerDetails() {
        assertThatThrownBy(() -> handler.handle(call(Map.of("name", "Jane Doe")), context))
                .isInstanceOf(ToolArgumentException.class)
                .hasMessageContaining("dateOfBirth, date");
    }

    @Test
    void shouldListEveryMissingCallerDetail() {
        assertThatThrownBy(() -> handler.handle(call(Map.of()), context))
                .isInstanceOfSatisfying(ToolArgumentException.class, e ->
                        assertThat(e.getFields()).containsExactly("name", "dateOfBirth", "date"));
    }

    private static ToolCall call(Map<String, Object> args) {
        return ToolCall.builder().id("tc").name("cancel_calendar_event").args(args).build();
    }
}
