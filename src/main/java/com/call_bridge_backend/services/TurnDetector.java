package com.call_bridge_backend.services;

import com.call_bridge_backend.config.VadConfig;

/**
 * Energy based end-of-turn detection for one call.
 *
 * <p>Speech starts when a frame crosses the speech threshold. While speaking, frames below the
 * silence threshold extend the silence run and frames above it count as active speech. A segment
 * is evaluated after enough consecutive silence or when it grows past the forced ceiling, and is
 * either committed or discarded; both reset every counter.
 *
 * <p>Not shared between calls. Methods are synchronized so teardown can reset from another thread.
 */
public class TurnDetector {

    public enum Decision {
        NONE,
        SPEECH_STARTED,
        COMMIT,
        DISCARD
    }

    private final VadConfig config;

    private boolean speaking;
    private int silenceFrames;
    private int speechFrames;
    private double speechEnergy;
    private int framesSinceCommit;

    public TurnDetector(VadConfig config) {
        if (config.getSpeechThreshold() <= config.getSilenceThreshold()) {
            throw new IllegalArgumentException("voice.vad.speech-threshold must be greater than voice.vad.silence-threshold");
        }
        this.config = config;
    }

    public synchronized Decision onFrame(double energy) {
        if (!speaking) {
            if (energy < config.getSpeechThreshold()) {
                return Decision.NONE;
            }
            speaking = true;
            framesSinceCommit = 1;
            silenceFrames = 0;
            speechFrames = 1;
            speechEnergy = energy;
            return Decision.SPEECH_STARTED;
        }

        framesSinceCommit++;
        if (energy < config.getSilenceThreshold()) {
            silenceFrames++;
        } else {
            silenceFrames = 0;
            speechFrames++;
            speechEnergy += energy;
        }

        if (silenceFrames >= config.getSilenceFramesToCommit()
                || framesSinceCommit > config.getMaxFramesBeforeCommit()) {
            return evaluate();
        }
        return Decision.NONE;
    }

    private Decision evaluate() {
        double averageEnergy = speechFrames == 0 ? 0.0 : speechEnergy / speechFrames;
        boolean accept = speechFrames >= config.getMinSpeechFrames()
                && averageEnergy >= config.getMinAverageEnergy();
        reset();
        return accept ? Decision.COMMIT : Decision.DISCARD;
    }

    public synchronized void reset() {
        speaking = false;
        silenceFrames = 0;
        speechFrames = 0;
        speechEnergy = 0.0;
        framesSinceCommit = 0;
    }

    public synchronized boolean isSpeaking() {
        return speaking;
    }

    public synchronized int getSpeechFrames() {
        return speechFrames;
    }

    public synchronized int getFramesSinceCommit() {
        return framesSinceCommit;
    }
}
