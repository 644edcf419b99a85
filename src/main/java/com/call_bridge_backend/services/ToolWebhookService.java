package com.call_bridge_backend.services;

import com.call_bridge_backend.config.WorkerConfig;
import com.call_bridge_backend.dto.ToolCall;
import com.call_bridge_backend.dto.ToolResponse;
import com.call_bridge_backend.models.ActiveCallSession;
import com.call_bridge_backend.services.realtime.RealtimeGateway;
import com.call_bridge_backend.services.tools.ToolCallNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Handles the provider's tool-call webhook. The call is resolved by provider call id, then by
 * carrier call id; a call owned by another worker is forwarded there; otherwise the sole active
 * local call is used.
 */
@Service
@Slf4j
public class ToolWebhookService {

    public static final String PROXY_TOKEN_HEADER = "X-Internal-Tool-Proxy-Token";
    static final String INTERNAL_PATH = "/internal/vapi/tools";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final CallSessionRegistry registry;
    private final RealtimeGateway gateway;
    private final ToolCallNormalizer normalizer;
    private final WorkerConfig workerConfig;
    private final RestTemplate workerRestTemplate;
    private final ObjectMapper objectMapper;

    public ToolWebhookService(CallSessionRegistry registry,
                              RealtimeGateway gateway,
                              ToolCallNormalizer normalizer,
                              WorkerConfig workerConfig,
                              @Qualifier("workerRestTemplate") RestTemplate workerRestTemplate,
                              ObjectMapper objectMapper) {
        this.registry = registry;
        this.gateway = gateway;
        this.normalizer = normalizer;
        this.workerConfig = workerConfig;
        this.workerRestTemplate = workerRestTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * @param allowForward false for requests that were already forwarded by another worker
     */
    public Map<String, Object> handle(JsonNode body, boolean allowForward) {
        JsonNode message = body.path("message").isObject() ? body.path("message") : body;
        List<ToolCall> calls = normalizer.normalizeAll(message);
        if (calls.isEmpty()) {
            log.warn("Tool webhook without tool calls");
            return results(List.of());
        }

        String aiCallId = firstText(message.path("call").path("id"), body.path("call").path("id"), message.path("callId"));
        String carrierCallId = firstText(
                message.path("call").path("phoneCallProviderId"),
                message.path("call").path("metadata").path("callSid"),
                message.path("metadata").path("callSid"),
                message.path("callSid"));

        Optional<CallSession> session = registry.findByAiSessionId(aiCallId)
                .or(() -> registry.findByCallId(carrierCallId))
                .or(() -> registry.findByCallId(aiCallId));
        if (session.isPresent()) {
            log.info("[{}] Running {} webhook tool calls", session.get().getCallId(), calls.size());
            return format(session.get().executeToolCalls(calls));
        }

        if (allowForward) {
            Optional<Map<String, Object>> forwarded = forwardToOwner(aiCallId, body);
            if (forwarded.isPresent()) {
                return forwarded.get();
            }
        }

        session = registry.resolveActiveSession(null);
        if (session.isPresent()) {
            log.info("[{}] Webhook for unknown call {} resolved to the only active call", session.get().getCallId(), aiCallId);
            return format(session.get().executeToolCalls(calls));
        }

        log.warn("No active call for tool webhook (ai call {}, carrier call {})", aiCallId, carrierCallId);
        List<ToolResponse> responses = new ArrayList<>();
        for (ToolCall call : calls) {
            responses.add(gateway.dispatchToolCall(carrierCallId, call));
        }
        return format(responses);
    }

    /**
     * Error answer for every tool call in the body, used when handling failed outright.
     */
    public Map<String, Object> failure(JsonNode body, String error) {
        JsonNode message = body != null && body.path("message").isObject() ? body.path("message") : body;
        List<ToolCall> calls = message == null ? List.of() : normalizer.normalizeAll(message);
        List<Map<String, Object>> results = new ArrayList<>();
        if (calls.isEmpty()) {
            results.add(errorResult("unknown", error));
        }
        for (ToolCall call : calls) {
            results.add(errorResult(call.getId(), error));
        }
        return results(results);
    }

    public boolean isAuthorized(String token) {
        return !workerConfig.hasProxyToken() || workerConfig.getProxyToken().equals(token);
    }

    private Optional<Map<String, Object>> forwardToOwner(String aiCallId, JsonNode body) {
        Optional<ActiveCallSession> record = registry.findRecord(aiCallId);
        if (record.isEmpty()) {
            return Optional.empty();
        }
        ActiveCallSession owner = record.get();
        if (workerConfig.getWorkerId().equals(owner.getWorkerId())) {
            return Optional.empty();
        }
        if (owner.getWorkerAddress() == null || owner.getWorkerAddress().isBlank()) {
            log.warn("Call {} is owned by worker {} without an address", aiCallId, owner.getWorkerId());
            return Optional.empty();
        }

        String url = stripTrailingSlash(owner.getWorkerAddress()) + INTERNAL_PATH;
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (workerConfig.hasProxyToken()) {
            headers.set(PROXY_TOKEN_HEADER, workerConfig.getProxyToken());
        }
        try {
            log.info("Forwarding tool webhook for call {} to worker {} ({})", aiCallId, owner.getWorkerId(), url);
            JsonNode response = workerRestTemplate.postForObject(url, new HttpEntity<>(body, headers), JsonNode.class);
            if (response == null || !response.isObject()) {
                return Optional.of(failure(body, "Empty response from worker " + owner.getWorkerId()));
            }
            return Optional.of(objectMapper.convertValue(response, MAP_TYPE));
        } catch (RestClientException e) {
            log.error("Forwarding tool webhook to {} failed: {}", url, e.getMessage());
            return Optional.of(failure(body, "Tool call could not be forwarded to the worker handling this call"));
        }
    }

    Map<String, Object> format(List<ToolResponse> responses) {
        List<Map<String, Object>> results = new ArrayList<>();
        for (ToolResponse response : responses) {
            if (response.getResult().isSuccess()) {
                Map<String, Object> result = new LinkedHashMap<>();
                result.put("toolCallId", response.getToolCallId());
                result.put("result", serialize(response));
                results.add(result);
            } else {
                results.add(errorResult(response.getToolCallId(), response.getResult().getError()));
            }
        }
        return results(results);
    }

    private String serialize(ToolResponse response) {
        try {
            return objectMapper.writeValueAsString(response.getResult());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize result of tool call {}", response.getToolCallId(), e);
            return "{\"success\":true}";
        }
    }

    private static Map<String, Object> errorResult(String toolCallId, String error) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("toolCallId", toolCallId);
        result.put("error", sanitize(error));
        return result;
    }

    private static Map<String, Object> results(List<Map<String, Object>> results) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("results", results);
        return body;
    }

    public static String sanitizeMessage(Throwable error) {
        return sanitize(error == null ? null : error.getMessage());
    }

    static String sanitize(String error) {
        if (error == null) {
            return "Unhandled server error in tool webhook";
        }
        String cleaned = error.replaceAll("[\\r\\n\\t]+", " ").trim();
        return cleaned.isEmpty() ? "Unhandled server error in tool webhook" : cleaned;
    }

    private static String stripTrailingSlash(String address) {
        String trimmed = address.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    private static String firstText(JsonNode... candidates) {
        for (JsonNode candidate : candidates) {
            if (candidate.isTextual() && !candidate.asText().isBlank()) {
                return candidate.asText().trim();
            }
        }
        return null;
    }
}
