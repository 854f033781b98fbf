package com.example.cratebridge.support;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;

/**
 * Synthetic audio for analysis tests.
 */
public final class TestSignals {

    private TestSignals() {
    }

    public static float[] sine(double frequency, double amplitude, double seconds, int sampleRate) {
        int length = (int) (seconds * sampleRate);
        float[] samples = new float[length];
        for (int i = 0; i < length; i++) {
            samples[i] = (float) (amplitude * Math.sin(2D * Math.PI * frequency * i / sampleRate));
        }
        return samples;
    }

    /**
     * Short decaying 1 kHz bursts on every beat.
     */
    public static float[] clickTrack(double bpm, double seconds, int sampleRate) {
        float[] samples = new float[(int) (seconds * sampleRate)];
        double beatSeconds = 60D / bpm;
        int burstLength = (int) (0.02D * sampleRate);
        for (double beat = 0D; beat < seconds; beat += beatSeconds) {
            int start = (int) Math.round(beat * sampleRate);
            for (int i = 0; i < burstLength && start + i < samples.length; i++) {
                double decay = Math.exp(-5D * i / burstLength);
                samples[start + i] = (float) (0.9D * decay * Math.sin(2D * Math.PI * 1000D * i / sampleRate));
            }
        }
        return samples;
    }

    public static void writeWav(File target, float[] samples, int sampleRate) throws IOException {
        byte[] pcm = new byte[samples.length * 2];
        for (int i = 0; i < samples.length; i++) {
            int value = (int) Math.max(Short.MIN_VALUE, Math.min(Short.MAX_VALUE, samples[i] * 32767D));
            pcm[2 * i] = (byte) (value & 0xFF);
            pcm[2 * i + 1] = (byte) ((value >> 8) & 0xFF);
        }
        AudioFormat format = new AudioFormat(sampleRate, 16, 1, true, false);
        try (AudioInputStream stream = new AudioInputStream(new ByteArrayInputStream(pcm), format, samples.length)) {
            AudioSystem.write(stream, AudioFileFormat.Type.WAVE, target);
        }
    }
}
