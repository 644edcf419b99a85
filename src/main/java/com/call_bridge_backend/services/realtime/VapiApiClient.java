package com.call_bridge_backend.services.realtime;

import com.call_bridge_backend.config.RealtimeConfig;
import com.call_bridge_backend.dto.realtime.AssistantRequest;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST calls against the voice provider: assistant lookup/create/update and realtime call creation.
 * Transport failures surface as {@link org.springframework.web.client.RestClientException}.
 */
@Service
@Slf4j
public class VapiApiClient {

    private final RestTemplate restTemplate;
    private final RealtimeConfig realtimeConfig;

    public VapiApiClient(@Qualifier("vapiRestTemplate") RestTemplate restTemplate, RealtimeConfig realtimeConfig) {
        this.restTemplate = restTemplate;
        this.realtimeConfig = realtimeConfig;
    }

    public Optional<String> findAssistantByName(String name) {
        String url = UriComponentsBuilder.fromHttpUrl(realtimeConfig.getBaseUrl())
                .path("/assistant")
                .queryParam("name", name)
                .build()
                .toUriString();
        JsonNode body = exchange(url, HttpMethod.GET, null);

        for (JsonNode assistant : assistantList(body)) {
            if (name.equals(assistant.path("name").asText(null))) {
                Optional<String> id = extractId(assistant);
                if (id.isPresent()) {
                    log.debug("Found assistant {} with name {}", id.get(), name);
                    return id;
                }
            }
        }
        return Optional.empty();
    }

    public String createAssistant(AssistantRequest request) {
        JsonNode body = exchange(realtimeConfig.getBaseUrl() + "/assistant", HttpMethod.POST, request);
        String id = extractId(body).orElseThrow(() ->
                new IllegalStateException("Assistant create response did not contain an id"));
        log.info("Created assistant {} ({})", request.getName(), id);
        return id;
    }

    public String updateAssistant(String assistantId, AssistantRequest request) {
        JsonNode body = exchange(realtimeConfig.getBaseUrl() + "/assistant/" + assistantId, HttpMethod.PATCH, request);
        String id = extractId(body).orElse(assistantId);
        log.info("Updated assistant {} ({})", request.getName(), id);
        return id;
    }

    /**
     * Create a realtime call for an assistant using the websocket transport with raw μ-law audio.
     */
    public JsonNode createCall(String assistantId, Map<String, Object> metadata) {
        Map<String, Object> audioFormat = new LinkedHashMap<>();
        audioFormat.put("format", realtimeConfig.getAudioEncoding());
        audioFormat.put("container", "raw");
        audioFormat.put("sampleRate", realtimeConfig.getAudioSampleRate());

        Map<String, Object> transport = new LinkedHashMap<>();
        transport.put("provider", realtimeConfig.getTransportProvider());
        transport.put("audioFormat", audioFormat);

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("assistantId", assistantId);
        request.put("transport", transport);
        if (metadata != null && !metadata.isEmpty()) {
            request.put("metadata", metadata);
        }

        JsonNode body = exchange(realtimeConfig.getBaseUrl() + "/call", HttpMethod.POST, request);
        if (body == null || body.isMissingNode() || body.isNull()) {
            throw new IllegalStateException("Empty response when creating realtime call");
        }
        return body;
    }

    private JsonNode exchange(String url, HttpMethod method, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(realtimeConfig.getApiKey() == null ? "" : realtimeConfig.getApiKey());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (body != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        ResponseEntity<JsonNode> response = restTemplate.exchange(url, method, new HttpEntity<>(body, headers), JsonNode.class);
        return response.getBody();
    }

    private static Iterable<JsonNode> assistantList(JsonNode body) {
        if (body == null) {
            return List.of();
        }
        if (body.isArray()) {
            return body;
        }
        for (String key : List.of("assistants", "items", "data", "results")) {
            if (body.path(key).isArray()) {
                return body.path(key);
            }
        }
        return body.isObject() ? List.of(body) : List.of();
    }

    static Optional<String> extractId(JsonNode node) {
        if (node == null) {
            return Optional.empty();
        }
        for (JsonNode candidate : List.of(node, node.path("assistant"), node.path("data"))) {
            for (String key : List.of("id", "_id")) {
                String value = candidate.path(key).asText("");
                if (!value.isBlank()) {
                    return Optional.of(value);
                }
            }
        }
        return Optional.empty();
    }
}
