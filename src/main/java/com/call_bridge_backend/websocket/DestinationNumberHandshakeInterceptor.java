package com.call_bridge_backend.websocket;

import com.call_bridge_backend.utils.PhoneNumbers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Rejects media-stream upgrades without a valid {@code to} number with a plain-text 400.
 * When {@code to} is repeated, the first valid value wins.
 */
@Component
@Slf4j
public class DestinationNumberHandshakeInterceptor implements HandshakeInterceptor {

    public static final String DESTINATION_ATTRIBUTE = "destinationNumber";
    static final String REJECTION_MESSAGE = "Missing or invalid 'to' phone number";

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) throws Exception {
        List<String> rawValues = UriComponentsBuilder.fromUri(request.getURI())
                .build()
                .getQueryParams()
                .getOrDefault("to", List.of());
        List<String> values = rawValues.stream()
                .filter(value -> value != null)
                .map(value -> UriUtils.decode(value, StandardCharsets.UTF_8))
                .collect(Collectors.toList());

        Optional<String> destination = PhoneNumbers.firstValid(values);
        if (destination.isEmpty()) {
            log.warn("Rejecting media stream upgrade from {}: invalid destination {}", request.getRemoteAddress(), values);
            response.setStatusCode(HttpStatus.BAD_REQUEST);
            response.getHeaders().setContentType(MediaType.TEXT_PLAIN);
            response.getBody().write(REJECTION_MESSAGE.getBytes(StandardCharsets.UTF_8));
            response.flush();
            return false;
        }

        attributes.put(DESTINATION_ATTRIBUTE, destination.get());
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.warn("Media stream handshake failed: {}", exception.getMessage());
        }
    }
}
