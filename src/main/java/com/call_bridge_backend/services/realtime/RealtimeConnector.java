package com.call_bridge_backend.services.realtime;

import com.call_bridge_backend.config.RealtimeConfig;
import com.call_bridge_backend.exceptions.CallBridgeExceptionHandler.RealtimeConnectionException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Opens the realtime socket for a call: creates the provider call, then tries every connection
 * URL it returned followed by the configured fallback. A handshake failure that names another
 * websocket URL is followed once per distinct URL.
 */
@Service
@Slf4j
public class RealtimeConnector {

    private static final Pattern WEBSOCKET_URL = Pattern.compile("wss?://[^\\s\"'<>,;)\\]}]+");
    private static final int SEND_TIME_LIMIT_MS = 5000;
    private static final int SEND_BUFFER_LIMIT_BYTES = 512 * 1024;

    private final VapiApiClient apiClient;
    private final WebSocketClient webSocketClient;
    private final RealtimeEventNormalizer normalizer;
    private final RealtimeConfig realtimeConfig;
    private final ObjectMapper objectMapper;

    public RealtimeConnector(VapiApiClient apiClient,
                             @Qualifier("realtimeWebSocketClient") WebSocketClient webSocketClient,
                             RealtimeEventNormalizer normalizer,
                             RealtimeConfig realtimeConfig,
                             ObjectMapper objectMapper) {
        this.apiClient = apiClient;
        this.webSocketClient = webSocketClient;
        this.normalizer = normalizer;
        this.realtimeConfig = realtimeConfig;
        this.objectMapper = objectMapper;
    }

    public RealtimeSession connect(String callId, String assistantId, RealtimeSessionListener listener) {
        JsonNode call;
        try {
            call = apiClient.createCall(assistantId, Map.of("callSid", callId));
        } catch (RuntimeException e) {
            log.error("[{}] Failed to create realtime call for assistant {}", callId, assistantId, e);
            throw new RealtimeConnectionException("Failed to create realtime call", List.of(), List.of(e));
        }

        String aiCallId = call.path("id").asText(null);
        List<String> candidates = candidateUrls(call, aiCallId);
        log.info("[{}] Realtime call {} created, {} candidate URLs", callId, aiCallId, candidates.size());

        Deque<String> queue = new ArrayDeque<>(candidates);
        Set<String> visited = new HashSet<>();
        List<String> attempted = new ArrayList<>();
        List<Throwable> causes = new ArrayList<>();

        while (!queue.isEmpty()) {
            String url = queue.pollFirst();
            if (!visited.add(url)) {
                continue;
            }
            attempted.add(url);
            try {
                WebSocketSession socket = open(callId, url, listener);
                log.info("[{}] Realtime session established via {}", callId, url);
                // sends arrive from several threads
                WebSocketSession serialized = new ConcurrentWebSocketSessionDecorator(socket, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES);
                return new RealtimeSession(callId, aiCallId, serialized, objectMapper);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                causes.add(e);
                throw new RealtimeConnectionException("Interrupted while connecting to realtime session", attempted, causes);
            } catch (ExecutionException | TimeoutException | RuntimeException e) {
                Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                causes.add(cause);
                log.warn("[{}] Realtime handshake with {} failed: {}", callId, url, cause.getMessage());

                String redirect = findRedirectUrl(cause, visited);
                if (redirect != null) {
                    log.info("[{}] Following realtime redirect to {}", callId, redirect);
                    queue.addFirst(redirect);
                }
            }
        }

        log.error("[{}] All realtime URLs failed: {}", callId, attempted);
        throw new RealtimeConnectionException("Unable to connect to realtime session", attempted, causes);
    }

    private WebSocketSession open(String callId, String url, RealtimeSessionListener listener)
            throws InterruptedException, ExecutionException, TimeoutException {
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        if (realtimeConfig.getApiKey() != null && !realtimeConfig.getApiKey().isBlank()) {
            headers.setBearerAuth(realtimeConfig.getApiKey());
        }
        RealtimeEventHandler handler = new RealtimeEventHandler(callId, normalizer, listener);
        CompletableFuture<WebSocketSession> future = webSocketClient.execute(handler, headers, URI.create(url));
        try {
            return future.get(realtimeConfig.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        }
    }

    /**
     * Connection URLs advertised by the provider call, most specific first, then the fallback.
     */
    List<String> candidateUrls(JsonNode call, String aiCallId) {
        Set<String> urls = new LinkedHashSet<>();
        JsonNode transport = call.path("transport");
        addUrl(urls, transport.path("websocketCallUrl"));
        addUrl(urls, transport.path("websocketUrl"));
        addUrl(urls, transport.path("url"));
        addUrl(urls, call.path("websocketCallUrl"));
        addUrl(urls, call.path("webSocketUrl"));
        if (aiCallId != null && !aiCallId.isBlank()) {
            String fallback = realtimeConfig.getRealtimeUrlForCall(aiCallId);
            if (fallback != null) {
                urls.add(fallback);
            }
        }
        return new ArrayList<>(urls);
    }

    private static void addUrl(Set<String> urls, JsonNode value) {
        if (value.isTextual() && !value.asText().isBlank()) {
            urls.add(value.asText().trim());
        }
    }

    /**
     * First websocket URL in the cause chain that has not been tried yet.
     */
    static String findRedirectUrl(Throwable error, Set<String> visited) {
        Set<Throwable> seen = new HashSet<>();
        Throwable current = error;
        while (current != null && seen.add(current)) {
            String message = current.getMessage();
            if (message != null) {
                Matcher matcher = WEBSOCKET_URL.matcher(message);
                while (matcher.find()) {
                    if (!visited.contains(matcher.group())) {
                        return matcher.group();
                    }
                }
            }
            current = current.getCause();
        }
        return null;
    }
}
