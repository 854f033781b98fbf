package com.example.cratebridge.infrastructure.analysis;

import java.io.File;
import java.io.IOException;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decodes a fixed window of an audio file into mono samples at the analysis rate.
 *
 * <p>Never reads past {@code offset + duration}.
 */
@Component
public class PcmExcerptLoader {

    private static final Logger log = LoggerFactory.getLogger(PcmExcerptLoader.class);

    private static final int BUFFER_BYTES = 16384;

    public float[] load(File audioFile, double offsetSec, double durationSec, int targetRate) throws AnalysisException {
        if (durationSec <= 0 || targetRate <= 0) {
            throw new AnalysisException("invalid excerpt window duration=" + durationSec + " rate=" + targetRate);
        }
        try (AudioInputStream source = AudioSystem.getAudioInputStream(audioFile)) {
            AudioFormat base = source.getFormat();
            float sourceRate = base.getSampleRate();
            int channels = base.getChannels();
            if (sourceRate <= 0 || channels <= 0) {
                throw new AnalysisException("stream format not specified: " + base);
            }
            AudioFormat pcm = new AudioFormat(AudioFormat.Encoding.PCM_SIGNED, sourceRate, 16, channels,
                    channels * 2, sourceRate, false);
            try (AudioInputStream decoded = AudioSystem.getAudioInputStream(pcm, source)) {
                int frameSize = channels * 2;
                long skipBytes = (long) (offsetSec * sourceRate) * frameSize;
                long wantedFrames = (long) (durationSec * sourceRate);
                discard(decoded, skipBytes);
                float[] mono = readMono(decoded, wantedFrames, channels);
                if (mono.length == 0) {
                    throw new AnalysisException("excerpt is empty at offset " + offsetSec + "s");
                }
                log.debug("PCM_EXCERPT file={} offset={} frames={} sourceRate={}",
                        audioFile.getName(), offsetSec, mono.length, sourceRate);
                return resample(mono, sourceRate, targetRate);
            }
        } catch (UnsupportedAudioFileException e) {
            throw new AnalysisException("no decoder for " + audioFile.getName(), e);
        } catch (IllegalArgumentException e) {
            throw new AnalysisException("cannot convert to PCM: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new AnalysisException("decode failed: " + e.getMessage(), e);
        }
    }

    private void discard(AudioInputStream stream, long bytes) throws IOException {
        byte[] scratch = new byte[BUFFER_BYTES];
        long remaining = bytes;
        while (remaining > 0) {
            int read = stream.read(scratch, 0, (int) Math.min(scratch.length, remaining));
            if (read < 0) {
                return;
            }
            remaining -= read;
        }
    }

    private float[] readMono(AudioInputStream stream, long wantedFrames, int channels) throws IOException {
        int frameSize = channels * 2;
        long wantedBytes = wantedFrames * frameSize;
        if (wantedBytes > Integer.MAX_VALUE - 8) {
            wantedBytes = (Integer.MAX_VALUE - 8) / frameSize * frameSize;
        }
        byte[] data = new byte[(int) wantedBytes];
        int filled = 0;
        while (filled < data.length) {
            int read = stream.read(data, filled, Math.min(BUFFER_BYTES, data.length - filled));
            if (read < 0) {
                break;
            }
            filled += read;
        }
        int frames = filled / frameSize;
        float[] mono = new float[frames];
        for (int frame = 0; frame < frames; frame++) {
            int base = frame * frameSize;
            float sum = 0F;
            for (int channel = 0; channel < channels; channel++) {
                int lo = data[base + channel * 2] & 0xFF;
                int hi = data[base + channel * 2 + 1];
                sum += (short) ((hi << 8) | lo) / 32768F;
            }
            mono[frame] = sum / channels;
        }
        return mono;
    }

    static float[] resample(float[] samples, float sourceRate, int targetRate) {
        if (Math.abs(sourceRate - targetRate) < 1F || samples.length == 0) {
            return samples;
        }
        double ratio = sourceRate / targetRate;
        int length = (int) (samples.length / ratio);
        float[] out = new float[length];
        for (int i = 0; i < length; i++) {
            double position = i * ratio;
            int index = (int) position;
            double fraction = position - index;
            float current = samples[Math.min(index, samples.length - 1)];
            float next = samples[Math.min(index + 1, samples.length - 1)];
            out[i] = (float) (current + (next - current) * fraction);
        }
        return out;
    }
}
