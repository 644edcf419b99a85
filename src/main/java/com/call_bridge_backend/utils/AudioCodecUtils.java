package com.call_bridge_backend.utils;

/**
 * G.711 μ-law helpers for the carrier leg plus frame energy used by turn detection.
 * All methods are stateless and run in time linear to the frame length.
 */
public final class AudioCodecUtils {

    private static final int BIAS = 0x84;
    private static final int CLIP = 32635;

    private AudioCodecUtils() {
    }

    /**
     * Decode a single μ-law byte to a 16-bit linear sample.
     */
    public static short decodeMulaw(byte mulaw) {
        int value = ~mulaw & 0xFF;
        int sign = value & 0x80;
        int exponent = (value >> 4) & 0x07;
        int mantissa = value & 0x0F;
        int sample = (((mantissa << 3) + BIAS) << exponent) - BIAS;
        return (short) (sign != 0 ? -sample : sample);
    }

    /**
     * Decode a μ-law frame to 16-bit linear PCM samples.
     */
    public static short[] decodeMulaw(byte[] frame) {
        if (frame == null) {
            return new short[0];
        }
        short[] samples = new short[frame.length];
        for (int i = 0; i < frame.length; i++) {
            samples[i] = decodeMulaw(frame[i]);
        }
        return samples;
    }

    /**
     * Encode a 16-bit linear sample to μ-law. Samples beyond the μ-law range are clipped.
     */
    public static byte encodeMulaw(short pcm) {
        int sample = pcm;
        int sign = 0;
        if (sample < 0) {
            sign = 0x80;
            sample = -sample;
        }
        if (sample > CLIP) {
            sample = CLIP;
        }
        sample += BIAS;

        int exponent = 7;
        for (int mask = 0x4000; (sample & mask) == 0 && exponent > 0; mask >>= 1) {
            exponent--;
        }
        int mantissa = (sample >> (exponent + 3)) & 0x0F;
        return (byte) ~(sign | (exponent << 4) | mantissa);
    }

    /**
     * Root-mean-square energy of a PCM frame. An empty frame has zero energy.
     */
    public static double frameEnergy(short[] samples) {
        if (samples == null || samples.length == 0) {
            return 0.0;
        }
        long sum = 0;
        for (short sample : samples) {
            sum += (long) sample * sample;
        }
        return Math.sqrt((double) sum / samples.length);
    }

    /**
     * Energy of a μ-law frame without materializing the decoded samples.
     */
    public static double mulawFrameEnergy(byte[] frame) {
        if (frame == null || frame.length == 0) {
            return 0.0;
        }
        long sum = 0;
        for (byte b : frame) {
            int sample = decodeMulaw(b);
            sum += (long) sample * sample;
        }
        return Math.sqrt((double) sum / frame.length);
    }
}
