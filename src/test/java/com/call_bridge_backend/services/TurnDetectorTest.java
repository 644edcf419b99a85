package com.call_bridge_backend.services;

import com.call_bridge_backend.config.VadConfig;
import com.call_bridge_backend.services.TurnDetector.Decision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TurnDetectorTest {

    private static final double SPEECH = 2000.0;
    private static final double SILENCE = 100.0;

    private VadConfig config;
    private TurnDetector detector;

    @BeforeEach
    void setUp() {
        config = new VadConfig();
        detector = new TurnDetector(config);
    }

    @Test
    void shouldNeverCommitOnSilence() {
        List<Decision> decisions = feed(SILENCE, 2000);

        assertThat(decisions).containsOnly(Decision.NONE);
        assertThat(detector.isSpeaking()).isFalse();
    }

    @Test
    void shouldCommitOnceAfterSpeechFollowedBySilence() {
        List<Decision> decisions = new ArrayList<>();
        decisions.addAll(feed(SPEECH, 10));
        decisions.addAll(feed(SILENCE, 100));

        assertThat(decisions.get(0)).isEqualTo(Decision.SPEECH_STARTED);
        assertThat(decisions).filteredOn(d -> d == Decision.COMMIT).hasSize(1);
        assertThat(decisions.indexOf(Decision.COMMIT)).isEqualTo(10 + config.getSilenceFramesToCommit() - 1);
        assertThat(detector.isSpeaking()).isFalse();
    }

    @Test
    void shouldForceCommitDuringContinuousSpeech() {
        List<Decision> decisions = feed(SPEECH, 600);

        assertThat(decisions).filteredOn(d -> d == Decision.COMMIT).hasSize(1);
        assertThat(decisions.indexOf(Decision.COMMIT)).isEqualTo(config.getMaxFramesBeforeCommit());
        // speech keeps going, so a new segment starts right after the forced commit
        assertThat(decisions.get(config.getMaxFramesBeforeCommit() + 1)).isEqualTo(Decision.SPEECH_STARTED);
    }

    @Test
    void shouldDiscardShortNoise() {
        List<Decision> decisions = new ArrayList<>();
        decisions.addAll(feed(1000.0, 3));
        decisions.addAll(feed(SILENCE, 30));

        assertThat(decisions).doesNotContain(Decision.COMMIT);
        assertThat(decisions).filteredOn(d -> d == Decision.DISCARD).hasSize(1);
    }

    @Test
    void shouldDiscardQuietSegment() {
        config.setMinAverageEnergy(5000.0);

        List<Decision> decisions = new ArrayList<>();
        decisions.addAll(feed(SPEECH, 20));
        decisions.addAll(feed(SILENCE, 30));

        assertThat(decisions).doesNotContain(Decision.COMMIT).contains(Decision.DISCARD);
    }

    @Test
    void shouldTreatMidLevelFramesAsSpeechOnceSpeaking() {
        detector.onFrame(SPEECH);
        detector.onFrame(600.0);
        detector.onFrame(600.0);

        assertThat(detector.getSpeechFrames()).isEqualTo(3);
        assertThat(detector.getFramesSinceCommit()).isEqualTo(3);
    }

    @Test
    void shouldClearStateOnReset() {
        feed(SPEECH, 5);

        detector.reset();

        assertThat(detector.isSpeaking()).isFalse();
        assertThat(detector.getSpeechFrames()).isZero();
        assertThat(detector.onFrame(SILENCE)).isEqualTo(Decision.NONE);
    }

    @Test
    void shouldRejectInvertedThresholds() {
        VadConfig inverted = new VadConfig();
        inverted.setSpeechThreshold(400.0);
        inverted.setSilenceThreshold(500.0);

        assertThatThrownBy(() -> new TurnDetector(inverted))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("speech-threshold");
    }

    private List<Decision> feed(double energy, int frames) {
        List<Decision> decisions = new ArrayList<>();
        for (int i = 0; i < frames; i++) {
            decisions.add(detector.onFrame(energy));
        }
        return decisions;
    }
}
