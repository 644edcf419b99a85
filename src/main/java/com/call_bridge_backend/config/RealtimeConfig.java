package com.call_bridge_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "vapi")
@Data
public class RealtimeConfig {

    private String apiKey;
    private String baseUrl = "https://api.vapi.ai";
    private String realtimeUrl = "wss://api.vapi.ai/v1/realtime";
    private String assistantNamePrefix = "call-bridge";
    private String modelProvider = "openai";
    private String model = "gpt-4o";
    private String voiceProvider = "vapi";
    private String defaultVoiceId = "Elliot";
    private String transportProvider = "vapi.websocket";
    private String audioEncoding = "mulaw";
    private int audioSampleRate = 8000;
    private Duration connectTimeout = Duration.ofSeconds(10);
    private String toolWebhookUrl;

    /**
     * Fallback realtime URL for a provider call id, tried after the URLs returned by the API.
     */
    public String getRealtimeUrlForCall(String aiCallId) {
        if (realtimeUrl == null || realtimeUrl.isBlank()) {
            return null;
        }
        String separator = realtimeUrl.contains("?") ? "&" : "?";
        return realtimeUrl + separator + "callId=" + aiCallId;
    }
}
