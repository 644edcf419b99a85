package com.call_bridge_backend.services.tools;

import com.call_bridge_backend.dto.ToolCall;
import com.call_bridge_backend.dto.ToolResult;
import com.call_bridge_backend.exceptions.CallBridgeExceptionHandler.ToolArgumentException;
import com.call_bridge_backend.services.CallTransferService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransferCallHandlerTest {

    @Mock
    private ObjectProvider<CallTransferService> provider;
    @Mock
    private CallTransferService transferService;

    private TransferCallHandler handler;

    @BeforeEach
    void setUp() {
        handler = new TransferCallHandler(provider);
    }

    @Test
    void shouldUseActiveCallWhenNoCallSidIsGiven() {
        when(provider.getIfAvailable()).thenReturn(transferService);

        ToolResult result = handler.handle(call(Map.of("number", "020-123 4567", "reason", "billing")), context("CA9"));

        verify(transferService).transferCall("CA9", "0201234567");
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getData()).isEqualTo(Map.of(
                "message", "Call transferred to 0201234567",
                "transferredTo", "0201234567",
                "callSid", "CA9",
                "reason", "billing"));
    }

    @Test
    void shouldPreferExplicitCallSid() {
        when(provider.getIfAvailable()).thenReturn(transferService);

        handler.handle(call(Map.of("phoneNumber", "+31201234567", "callSid", "CA_OTHER")), context("CA9"));

        verify(transferService).transferCall("CA_OTHER", "+31201234567");
    }

    @Test
    void shouldRejectInvalidNumberWithoutCallingCarrier() {
        assertThatThrownBy(() -> handler.handle(call(Map.of("phoneNumber", "reception")), context("CA9")))
                .isInstanceOf(ToolArgumentException.class)
                .hasMessage("Invalid phone number: reception");
        verifyNoInteractions(transferService);
    }

    @Test
    void shouldRequireAnActiveCall() {
        assertThatThrownBy(() -> handler.handle(call(Map.of("phoneNumber", "+31201234567")), context(null)))
                .isInstanceOf(ToolArgumentException.class)
                .hasMessageContaining("No active call");
    }

    @Test
    void shouldFailWhenTransferIsNotConfigured() {
        when(provider.getIfAvailable()).thenReturn(null);

        ToolResult result = handler.handle(call(Map.of("phoneNumber", "+31201234567")), context("CA9"));

        assertThat(result.getError()).isEqualTo("Call transfer is not configured");
    }

    private static ToolCall call(Map<String, Object> args) {
        return ToolCall.builder().id("tc").name("transfer_call").args(args).build();
    }

    private static ToolCallContext context(String callId) {
        return ToolCallContext.builder().callId(callId).build();
    }
}
