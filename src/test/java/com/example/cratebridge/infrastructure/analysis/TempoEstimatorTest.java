package com.example.cratebridge.infrastructure.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.example.cratebridge.support.TestSignals;
import org.junit.jupiter.api.Test;

class TempoEstimatorTest {

    private static final int SAMPLE_RATE = 22050;

    private final TempoEstimator estimator = new TempoEstimator(60D, 200D);

    @Test
    void shouldFindTempoOfClickTrack() throws Exception {
        float[] clicks = TestSignals.clickTrack(120D, 30D, SAMPLE_RATE);

        double bpm = estimator.estimate(clicks, SAMPLE_RATE);

        assertEquals(120D, bpm, 3D);
    }

    @Test
    void shouldRejectExcerptShorterThanOneFrame() {
        assertThrows(AnalysisException.class, () -> estimator.estimate(new float[100], SAMPLE_RATE));
    }

    @Test
    void shouldRejectInvalidRange() {
        assertThrows(IllegalArgumentException.class, () -> new TempoEstimator(120D, 60D));
    }
}
