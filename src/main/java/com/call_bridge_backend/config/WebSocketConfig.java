package com.call_bridge_backend.config;

import com.call_bridge_backend.websocket.DestinationNumberHandshakeInterceptor;
import com.call_bridge_backend.websocket.MediaStreamHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final MediaStreamHandler mediaStreamHandler;
    private final DestinationNumberHandshakeInterceptor destinationNumberInterceptor;
    private final VoiceConfig voiceConfig;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // Carrier media streams
        registry.addHandler(mediaStreamHandler, voiceConfig.getMediaStreamPath())
                .addInterceptors(destinationNumberInterceptor)
                .setAllowedOriginPatterns("*");
    }
}
