package com.example.cratebridge.infrastructure.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.example.cratebridge.support.TestSignals;
import org.junit.jupiter.api.Test;

class KeyEstimatorTest {

    private static final int SAMPLE_RATE = 22050;

    private final KeyEstimator estimator = new KeyEstimator();

    @Test
    void shouldReportTonicOfPureTone() throws Exception {
        float[] tone = TestSignals.sine(440D, 0.5D, 5D, SAMPLE_RATE);

        assertEquals("A", estimator.estimate(tone, SAMPLE_RATE));
    }

    @Test
    void shouldFailOnSilence() {
        assertThrows(AnalysisException.class, () -> estimator.estimate(new float[SAMPLE_RATE], SAMPLE_RATE));
    }
}
