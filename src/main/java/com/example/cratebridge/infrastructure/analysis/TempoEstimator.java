package com.example.cratebridge.infrastructure.analysis;

/**
 * Tempo from the autocorrelation of an onset-strength envelope.
 *
 * <p>The envelope is the half-wave rectified change in log frame energy. Candidate lags cover the configured BPM
 * range and are weighted by a log-normal prior centred on 120 BPM, so octave errors lean towards dance tempos.
 */
public class TempoEstimator {

    static final int FRAME_SIZE = 1024;
    static final int HOP_SIZE = 256;

    private static final double PRIOR_CENTER_BPM = 120D;
    private static final double PRIOR_STD_OCTAVES = 1D;

    private final double minBpm;
    private final double maxBpm;

    public TempoEstimator(double minBpm, double maxBpm) {
        if (minBpm <= 0 || maxBpm <= minBpm) {
            throw new IllegalArgumentException("invalid BPM range " + minBpm + ".." + maxBpm);
        }
        this.minBpm = minBpm;
        this.maxBpm = maxBpm;
    }

    public double estimate(float[] samples, int sampleRate) throws AnalysisException {
        double[] envelope = onsetEnvelope(samples);
        if (envelope.length < 4) {
            throw new AnalysisException("excerpt too short for tempo estimation");
        }
        double frameRate = (double) sampleRate / HOP_SIZE;
        int minLag = Math.max(1, (int) Math.floor(60D * frameRate / maxBpm));
        int maxLag = Math.min(envelope.length - 2, (int) Math.ceil(60D * frameRate / minBpm));
        if (maxLag <= minLag) {
            throw new AnalysisException("excerpt too short for the BPM range");
        }

        double[] autocorrelation = new double[maxLag + 2];
        for (int lag = minLag - 1; lag <= maxLag + 1; lag++) {
            if (lag < 1 || lag >= envelope.length) {
                continue;
            }
            double sum = 0D;
            for (int i = lag; i < envelope.length; i++) {
                sum += envelope[i] * envelope[i - lag];
            }
            autocorrelation[lag] = sum / (envelope.length - lag);
        }

        int bestLag = -1;
        double bestScore = 0D;
        for (int lag = minLag; lag <= maxLag; lag++) {
            double bpm = 60D * frameRate / lag;
            double score = autocorrelation[lag] * prior(bpm);
            if (score > bestScore) {
                bestScore = score;
                bestLag = lag;
            }
        }
        if (bestLag < 0) {
            throw new AnalysisException("no periodic onsets found");
        }

        double refinedLag = bestLag + parabolicOffset(
                autocorrelation[bestLag - 1], autocorrelation[bestLag], autocorrelation[bestLag + 1]);
        double bpm = 60D * frameRate / refinedLag;
        return Math.round(bpm * 10D) / 10D;
    }

    double[] onsetEnvelope(float[] samples) {
        if (samples == null || samples.length < FRAME_SIZE) {
            return new double[0];
        }
        int frames = 1 + (samples.length - FRAME_SIZE) / HOP_SIZE;
        double[] logEnergy = new double[frames];
        for (int frame = 0; frame < frames; frame++) {
            int start = frame * HOP_SIZE;
            double energy = 0D;
            for (int i = start; i < start + FRAME_SIZE; i++) {
                energy += samples[i] * samples[i];
            }
            logEnergy[frame] = Math.log(1e-6 + energy / FRAME_SIZE);
        }
        double[] envelope = new double[frames];
        double mean = 0D;
        for (int frame = 1; frame < frames; frame++) {
            envelope[frame] = Math.max(0D, logEnergy[frame] - logEnergy[frame - 1]);
            mean += envelope[frame];
        }
        mean /= frames;
        for (int frame = 0; frame < frames; frame++) {
            envelope[frame] -= mean;
        }
        return envelope;
    }

    private double prior(double bpm) {
        double octaves = Math.log(bpm / PRIOR_CENTER_BPM) / Math.log(2D);
        return Math.exp(-0.5D * (octaves / PRIOR_STD_OCTAVES) * (octaves / PRIOR_STD_OCTAVES));
    }

    private double parabolicOffset(double left, double center, double right) {
        double denominator = left - 2D * center + right;
        if (denominator == 0D) {
            return 0D;
        }
        double offset = 0.5D * (left - right) / denominator;
        return Math.max(-0.5D, Math.min(0.5D, offset));
    }
}
