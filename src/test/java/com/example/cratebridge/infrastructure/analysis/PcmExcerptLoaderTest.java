package com.example.cratebridge.infrastructure.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.example.cratebridge.support.TestSignals;
import java.io.File;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PcmExcerptLoaderTest {

    @TempDir
    Path tempDir;

    private final PcmExcerptLoader loader = new PcmExcerptLoader();

    @Test
    void shouldReadOnlyTheRequestedWindowAtTargetRate() throws Exception {
        File wav = tempDir.resolve("tone.wav").toFile();
        TestSignals.writeWav(wav, TestSignals.sine(440D, 0.5D, 4D, 44100), 44100);

        float[] excerpt = loader.load(wav, 1D, 2D, 22050);

        assertEquals(44100, excerpt.length, 2);
    }

    @Test
    void shouldFailWhenOffsetIsPastTheEnd() throws Exception {
        File wav = tempDir.resolve("short.wav").toFile();
        TestSignals.writeWav(wav, TestSignals.sine(440D, 0.5D, 1D, 22050), 22050);

        assertThrows(AnalysisException.class, () -> loader.load(wav, 30D, 15D, 22050));
    }

    @Test
    void shouldResampleLinearly() {
        float[] source = {0F, 1F, 2F, 3F};

        float[] resampled = PcmExcerptLoader.resample(source, 2F, 1);

        assertEquals(2, resampled.length);
        assertEquals(0F, resampled[0], 1e-6F);
        assertEquals(2F, resampled[1], 1e-6F);
    }
}
