package com.call_bridge_backend.config;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Turn detection tuning. Energies are RMS of 16-bit PCM; frames are carrier media frames (20 ms each).
 */
@Configuration
@ConfigurationProperties(prefix = "voice.vad")
@Validated
@Data
public class VadConfig {

    @Positive
    private double speechThreshold = 900.0;
    @PositiveOrZero
    private double silenceThreshold = 500.0;
    @Positive
    private int silenceFramesToCommit = 25;
    @Positive
    private int maxFramesBeforeCommit = 500;
    @PositiveOrZero
    private int minSpeechFrames = 8;
    @PositiveOrZero
    private double minAverageEnergy = 700.0;
}
