package com.example.cratebridge.infrastructure.analysis;

import com.example.cratebridge.common.util.KeyNames;

/**
 * Tonic estimate from a 12-bin chroma vector matched against Krumhansl-Schmuckler key profiles.
 */
public class KeyEstimator {

    static final int FRAME_SIZE = 4096;
    static final int HOP_SIZE = 2048;

    private static final int LOWEST_NOTE = 36;
    private static final int HIGHEST_NOTE = 95;

    private static final double[] MAJOR_PROFILE = {
            6.35, 2.23, 3.48, 2.33, 4.38, 4.09, 2.52, 5.19, 2.39, 3.66, 2.29, 2.88};
    private static final double[] MINOR_PROFILE = {
            6.33, 2.68, 3.52, 5.38, 2.60, 3.53, 2.54, 4.75, 3.98, 2.69, 3.34, 3.17};

    public String estimate(float[] samples, int sampleRate) throws AnalysisException {
        double[] chroma = chroma(samples, sampleRate);
        double total = 0D;
        for (double value : chroma) {
            total += value;
        }
        if (total <= 1e-9) {
            throw new AnalysisException("no tonal energy in excerpt");
        }

        int bestTonic = -1;
        double bestCorrelation = Double.NEGATIVE_INFINITY;
        for (int tonic = 0; tonic < 12; tonic++) {
            double major = correlate(chroma, MAJOR_PROFILE, tonic);
            double minor = correlate(chroma, MINOR_PROFILE, tonic);
            double score = Math.max(major, minor);
            if (score > bestCorrelation) {
                bestCorrelation = score;
                bestTonic = tonic;
            }
        }
        return KeyNames.nameOf(bestTonic);
    }

    double[] chroma(float[] samples, int sampleRate) throws AnalysisException {
        if (samples == null || samples.length < FRAME_SIZE) {
            throw new AnalysisException("excerpt too short for key estimation");
        }
        double[] window = hann(FRAME_SIZE);
        double[] coefficients = new double[HIGHEST_NOTE - LOWEST_NOTE + 1];
        for (int note = LOWEST_NOTE; note <= HIGHEST_NOTE; note++) {
            double frequency = 440D * Math.pow(2D, (note - 69) / 12D);
            coefficients[note - LOWEST_NOTE] = 2D * Math.cos(2D * Math.PI * frequency / sampleRate);
        }

        double[] chroma = new double[12];
        double[] frame = new double[FRAME_SIZE];
        for (int start = 0; start + FRAME_SIZE <= samples.length; start += HOP_SIZE) {
            for (int i = 0; i < FRAME_SIZE; i++) {
                frame[i] = samples[start + i] * window[i];
            }
            for (int note = LOWEST_NOTE; note <= HIGHEST_NOTE; note++) {
                chroma[note % 12] += goertzelPower(frame, coefficients[note - LOWEST_NOTE]);
            }
        }
        return chroma;
    }

    private double goertzelPower(double[] frame, double coefficient) {
        double previous = 0D;
        double beforePrevious = 0D;
        for (double sample : frame) {
            double current = sample + coefficient * previous - beforePrevious;
            beforePrevious = previous;
            previous = current;
        }
        return previous * previous + beforePrevious * beforePrevious - coefficient * previous * beforePrevious;
    }

    private double correlate(double[] chroma, double[] profile, int tonic) {
        double chromaMean = mean(chroma);
        double profileMean = mean(profile);
        double numerator = 0D;
        double chromaSquares = 0D;
        double profileSquares = 0D;
        for (int pitchClass = 0; pitchClass < 12; pitchClass++) {
            double c = chroma[pitchClass] - chromaMean;
            double p = profile[Math.floorMod(pitchClass - tonic, 12)] - profileMean;
            numerator += c * p;
            chromaSquares += c * c;
            profileSquares += p * p;
        }
        double denominator = Math.sqrt(chromaSquares * profileSquares);
        return denominator == 0D ? 0D : numerator / denominator;
    }

    private static double mean(double[] values) {
        double sum = 0D;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    private static double[] hann(int size) {
        double[] window = new double[size];
        for (int i = 0; i < size; i++) {
            window[i] = 0.5D - 0.5D * Math.cos(2D * Math.PI * i / (size - 1));
        }
        return window;
    }
}
