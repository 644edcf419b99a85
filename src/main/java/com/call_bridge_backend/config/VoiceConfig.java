package com.call_bridge_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "voice")
@Data
public class VoiceConfig {

    private String mediaStreamPath = "/ws";
    private Duration keepaliveInterval = Duration.ofSeconds(15);
    private int maxBufferedFrames = 200;
    private String timeZone = "Europe/Amsterdam";
    private int defaultOpenHour = 9;
    private int defaultCloseHour = 17;
}
