package com.call_bridge_backend.services;

import com.call_bridge_backend.config.WorkerConfig;
import com.call_bridge_backend.dto.ToolCall;
import com.call_bridge_backend.dto.ToolResponse;
import com.call_bridge_backend.dto.ToolResult;
import com.call_bridge_backend.models.ActiveCallSession;
import com.call_bridge_backend.services.realtime.RealtimeGateway;
import com.call_bridge_backend.services.tools.ToolCallNormalizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@ExtendWith(MockitoExtension.class)
class ToolWebhookServiceTest {

    private static final String BODY = "{\"message\":{\"type\":\"tool-calls\",\"call\":{\"id\":\"ai-1\"},"
            + "\"toolCallList\":[{\"id\":\"tc-1\",\"type\":\"function\","
            + "\"function\":{\"name\":\"transfer_call\",\"arguments\":{\"phoneNumber\":\"+31201234567\"}}}]}}";

    @Mock
    private CallSessionRegistry registry;
    @Mock
    private RealtimeGateway gateway;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final WorkerConfig workerConfig = new WorkerConfig();
    private final RestTemplate restTemplate = new RestTemplate();
    private MockRestServiceServer server;
    private ToolWebhookService service;

    @BeforeEach
    void setUp() {
        workerConfig.setId("worker-a");
        server = MockRestServiceServer.bindTo(restTemplate).build();
        service = new ToolWebhookService(registry, gateway, new ToolCallNormalizer(objectMapper),
                workerConfig, restTemplate, objectMapper);
    }

    @Test
    void shouldRunToolCallsOnLocalSessionFoundByAiCallId() throws Exception {
        CallSession session = mock(CallSession.class);
        when(session.getCallId()).thenReturn("CA1");
        when(registry.findByAiSessionId("ai-1")).thenReturn(Optional.of(session));
        when(session.executeToolCalls(anyList()))
                .thenReturn(List.of(new ToolResponse("tc-1", ToolResult.success(Map.of("transferred", true)))));

        Map<String, Object> response = service.handle(objectMapper.readTree(BODY), true);

        List<Map<String, Object>> results = results(response);
        assertThat(results).hasSize(1);
        assertThat(results.get(0)).containsEntry("toolCallId", "tc-1");
        assertThat((String) results.get(0).get("result")).contains("\"success\":true").contains("transferred");
        verifyNoInteractions(gateway);
    }

    @Test
    void shouldReturnEmptyResultsWithoutToolCalls() throws Exception {
        Map<String, Object> response = service.handle(objectMapper.readTree("{\"message\":{\"type\":\"tool-calls\"}}"), true);

        assertThat(results(response)).isEmpty();
        verifyNoInteractions(registry, gateway);
    }

    @Test
    void shouldForwardToOwningWorker() throws Exception {
        workerConfig.setProxyToken("secret");
        when(registry.findRecord("ai-1")).thenReturn(Optional.of(ActiveCallSession.builder()
                .callId("ai-1")
                .workerId("worker-b")
                .workerAddress("http://worker-b:8080/")
                .registeredAt(Instant.now())
                .build()));
        server.expect(requestTo("http://worker-b:8080/internal/vapi/tools"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(ToolWebhookService.PROXY_TOKEN_HEADER, "secret"))
                .andRespond(withSuccess("{\"results\":[{\"toolCallId\":\"tc-1\",\"result\":\"ok\"}]}",
                        MediaType.APPLICATION_JSON));

        Map<String, Object> response = service.handle(objectMapper.readTree(BODY), true);

        server.verify();
        assertThat(results(response).get(0)).containsEntry("result", "ok");
        verify(registry, never()).resolveActiveSession(any());
    }

    @Test
    void shouldAnswerWithErrorWhenForwardingFails() throws Exception {
        when(registry.findRecord("ai-1")).thenReturn(Optional.of(ActiveCallSession.builder()
                .callId("ai-1")
                .workerId("worker-b")
                .workerAddress("http://worker-b:8080")
                .registeredAt(Instant.now())
                .build()));
        server.expect(requestTo("http://worker-b:8080/internal/vapi/tools")).andRespond(withServerError());

        Map<String, Object> response = service.handle(objectMapper.readTree(BODY), true);

        Map<String, Object> result = results(response).get(0);
        assertThat(result).containsEntry("toolCallId", "tc-1");
        assertThat((String) result.get("error")).contains("could not be forwarded");
    }

    @Test
    void shouldNotForwardRequestsThatWereAlreadyForwarded() throws Exception {
        CallSession session = mock(CallSession.class);
        when(session.getCallId()).thenReturn("CA1");
        when(registry.resolveActiveSession(null)).thenReturn(Optional.of(session));
        when(session.executeToolCalls(anyList()))
                .thenReturn(List.of(new ToolResponse("tc-1", ToolResult.success(null))));

        service.handle(objectMapper.readTree(BODY), false);

        verify(registry, never()).findRecord(any());
        verify(session).executeToolCalls(anyList());
    }

    @Test
    void shouldFallBackToSoleActiveSession() throws Exception {
        CallSession session = mock(CallSession.class);
        when(session.getCallId()).thenReturn("CA1");
        when(registry.resolveActiveSession(null)).thenReturn(Optional.of(session));
        when(session.executeToolCalls(anyList()))
                .thenReturn(List.of(new ToolResponse("tc-1", ToolResult.failure("Transfer failed"))));

        Map<String, Object> response = service.handle(objectMapper.readTree(BODY), true);

        assertThat(results(response).get(0)).containsEntry("error", "Transfer failed");
    }

    @Test
    void shouldDispatchThroughGatewayWhenNoCallIsActive() throws Exception {
        when(gateway.dispatchToolCall(eq(null), any(ToolCall.class)))
                .thenReturn(new ToolResponse("tc-1", ToolResult.failure("No active call")));

        Map<String, Object> response = service.handle(objectMapper.readTree(BODY), true);

        assertThat(results(response).get(0)).containsEntry("toolCallId", "tc-1").containsEntry("error", "No active call");
    }

    @Test
    void shouldBuildFailureForEveryToolCall() throws Exception {
        Map<String, Object> response = service.failure(objectMapper.readTree(BODY), "boom\nline two");

        assertThat(results(response).get(0)).containsEntry("toolCallId", "tc-1").containsEntry("error", "boom line two");
    }

    @Test
    void shouldBuildFailureForUnreadableBody() {
        Map<String, Object> response = service.failure(null, null);

        assertThat(results(response).get(0))
                .containsEntry("toolCallId", "unknown")
                .containsEntry("error", "Unhandled server error in tool webhook");
    }

    @Test
    void shouldAuthorizeOnlyMatchingTokenWhenConfigured() {
        assertThat(service.isAuthorized(null)).isTrue();

        workerConfig.setProxyToken("secret");

        assertThat(service.isAuthorized("secret")).isTrue();
        assertThat(service.isAuthorized("other")).isFalse();
        assertThat(service.isAuthorized(null)).isFalse();
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> results(Map<String, Object> response) {
        return (List<Map<String, Object>>) response.get("results");
    }
}
