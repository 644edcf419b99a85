package com.call_bridge_backend.services.realtime;

import com.call_bridge_backend.dto.ToolCall;
import com.call_bridge_backend.dto.ToolResponse;
import com.call_bridge_backend.dto.ToolResult;
import com.call_bridge_backend.exceptions.CallBridgeExceptionHandler.CallSessionException;
import com.call_bridge_backend.models.BusinessConfig;
import com.call_bridge_backend.services.tools.ToolCallContext;
import com.call_bridge_backend.services.tools.ToolCallDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RealtimeGatewayTest {

    @Mock
    private AssistantProvisioner provisioner;
    @Mock
    private RealtimeConnector connector;
    @Mock
    private ToolCallDispatcher dispatcher;

    private RealtimeGateway gateway;
    private final BusinessConfig dentist = BusinessConfig.builder().companyId(1L).companyName("Dentist").build();
    private final BusinessConfig bakery = BusinessConfig.builder().companyId(2L).companyName("Bakery").build();

    @BeforeEach
    void setUp() {
        gateway = new RealtimeGateway(provisioner, connector, dispatcher);
    }

    @Test
    void shouldProvisionAssistantAndConnect() {
        RealtimeSessionListener listener = mock(RealtimeSessionListener.class);
        RealtimeSession session = mock(RealtimeSession.class);
        gateway.registerCallConfig("CA1", dentist);
        when(provisioner.ensureAssistant(dentist)).thenReturn("asst-1");
        when(connector.connect("CA1", "asst-1", listener)).thenReturn(session);

        assertThat(gateway.openSession("CA1", listener)).isSameAs(session);
    }

    @Test
    void shouldRefuseToOpenWithoutConfig() {
        assertThatThrownBy(() -> gateway.openSession("CA1", mock(RealtimeSessionListener.class)))
                .isInstanceOf(CallSessionException.class);
        verifyNoInteractions(provisioner, connector);
    }

    @Test
    void shouldUseCurrentConfigOnlyWhileOneCallIsRegistered() {
        gateway.registerCallConfig("CA1", dentist);
        assertThat(gateway.configFor("unknown")).contains(dentist);

        gateway.registerCallConfig("CA2", bakery);
        assertThat(gateway.configFor("CA1")).contains(dentist);
        assertThat(gateway.configFor("CA2")).contains(bakery);
        assertThat(gateway.configFor("unknown")).isEmpty();
        assertThat(gateway.configFor(null)).isEmpty();
    }

    @Test
    void shouldForgetReleasedConfig() {
        gateway.registerCallConfig("CA1", dentist);

        gateway.releaseCallConfig("CA1");

        assertThat(gateway.configFor("CA1")).isEmpty();
        assertThat(gateway.registeredCallCount()).isZero();
    }

    @Test
    void shouldDispatchToolCallWithCallContext() {
        gateway.registerCallConfig("CA1", dentist);
        gateway.registerCallConfig("CA2", bakery);
        ToolCall call = ToolCall.builder().id("tc").name("transfer_call").args(Map.of()).build();
        when(dispatcher.dispatch(eq(call), any())).thenReturn(new ToolResponse("tc", ToolResult.success(null)));

        gateway.dispatchToolCall("CA2", call);

        ArgumentCaptor<ToolCallContext> context = ArgumentCaptor.forClass(ToolCallContext.class);
        verify(dispatcher).dispatch(eq(call), context.capture());
        assertThat(context.getValue().getCallId()).isEqualTo("CA2");
        assertThat(context.getValue().getBusiness()).isSameAs(bakery);
    }
}
