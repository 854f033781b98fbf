package com.example.cratebridge.infrastructure.analysis;

/**
 * Mean short-time RMS scaled to 0..100.
 */
public class EnergyEstimator {

    static final int FRAME_SIZE = 2048;
    static final int HOP_SIZE = 512;

    public int estimate(float[] samples) throws AnalysisException {
        if (samples == null || samples.length == 0) {
            throw new AnalysisException("excerpt is empty");
        }
        int frameSize = Math.min(FRAME_SIZE, samples.length);
        double rmsSum = 0D;
        int frames = 0;
        for (int start = 0; start + frameSize <= samples.length; start += HOP_SIZE) {
            double squares = 0D;
            for (int i = start; i < start + frameSize; i++) {
                squares += samples[i] * samples[i];
            }
            rmsSum += Math.sqrt(squares / frameSize);
            frames++;
        }
        int energy = (int) (rmsSum / frames * 100D);
        return Math.max(0, Math.min(100, energy));
    }
}
