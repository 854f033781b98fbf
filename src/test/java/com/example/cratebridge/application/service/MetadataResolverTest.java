package com.example.cratebridge.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.cratebridge.common.config.AppScanProperties;
import com.example.cratebridge.common.util.KeyNames;
import com.example.cratebridge.domain.enumtype.AudioContainer;
import com.example.cratebridge.domain.model.TagData;
import com.example.cratebridge.domain.model.Track;
import com.example.cratebridge.infrastructure.analysis.AnalysisException;
import com.example.cratebridge.infrastructure.analysis.SignalAnalyzer;
import com.example.cratebridge.infrastructure.parser.AudioTagReader;
import com.example.cratebridge.infrastructure.parser.JaudiotaggerAudioTagReader;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MetadataResolverTest {

    @TempDir
    Path tempDir;

    private AudioTagReader audioTagReader;
    private SignalAnalyzer signalAnalyzer;
    private MetadataResolver resolver;

    @BeforeEach
    void setUp() {
        audioTagReader = mock(AudioTagReader.class);
        signalAnalyzer = mock(SignalAnalyzer.class);
        resolver = new MetadataResolver(audioTagReader, signalAnalyzer, new MetadataFallbackService(),
                new AppScanProperties());
    }

    @Test
    void missingFileShouldBecomeCorruptTrackWithDefaults() {
        Track track = resolver.resolve(tempDir.resolve("ghost.mp3"));

        assertTrue(track.isCorrupt());
        assertFalse(track.isPlayable());
        assertEquals("File does not exist", track.getErrorMessage());
        assertEquals("ghost", track.getTitle());
        assertEquals(Track.UNKNOWN_ARTIST, track.getArtist());
        assertEquals(0D, track.getBpm());
        assertEquals(KeyNames.UNKNOWN, track.getKey());
        assertEquals(0, track.getEnergy());
        verifyNoInteractions(audioTagReader, signalAnalyzer);
    }

    @Test
    void tinyFileShouldBeCorrupt() throws Exception {
        Path tiny = tempDir.resolve("tiny.mp3");
        Files.write(tiny, new byte[100]);

        Track track = resolver.resolve(tiny);

        assertTrue(track.isCorrupt());
        assertEquals("File is too small (100 bytes)", track.getErrorMessage());
        verifyNoInteractions(audioTagReader, signalAnalyzer);
    }

    @Test
    void unsupportedExtensionShouldBeCorrupt() throws Exception {
        Path ogg = tempDir.resolve("song.ogg");
        Files.write(ogg, new byte[2048]);

        Track track = resolver.resolve(ogg);

        assertTrue(track.isCorrupt());
        assertEquals("Unsupported audio format: .ogg", track.getErrorMessage());
    }

    @Test
    void zeroFilledFlacShouldBeCorruptWithoutAnalysis() throws Exception {
        Path flac = tempDir.resolve("broken.flac");
        Files.write(flac, new byte[2048]);
        MetadataResolver realReader = new MetadataResolver(new JaudiotaggerAudioTagReader(), signalAnalyzer,
                new MetadataFallbackService(), new AppScanProperties());

        Track track = realReader.resolve(flac);

        assertTrue(track.isCorrupt());
        assertTrue(track.getErrorMessage().startsWith("Invalid FLAC file"), track.getErrorMessage());
        assertEquals("broken", track.getTitle());
        verifyNoInteractions(signalAnalyzer);
    }

    @Test
    void tagBpmAndKeyShouldWinOverAnalysis() throws Exception {
        Path mp3 = tempDir.resolve("tagged.mp3");
        Files.write(mp3, new byte[4096]);
        TagData tags = new TagData();
        tags.setTitle(" Night Drive ");
        tags.setArtist("Kavinsky");
        tags.setBpm(128D);
        tags.setKey("Am");
        tags.setDurationSec(245.5D);
        when(audioTagReader.read(any(File.class), eq(AudioContainer.MP3))).thenReturn(tags);
        when(signalAnalyzer.estimateEnergy(any(File.class))).thenReturn(72);

        Track track = resolver.resolve(mp3);

        assertFalse(track.isCorrupt());
        assertEquals("Night Drive", track.getTitle());
        assertEquals("Kavinsky", track.getArtist());
        assertEquals(Track.UNKNOWN_ALBUM, track.getAlbum());
        assertEquals(128D, track.getBpm());
        assertEquals("A", track.getKey());
        assertEquals(72, track.getEnergy());
        assertEquals(245.5D, track.getDuration());
        verify(signalAnalyzer, never()).estimateTempo(any(File.class));
        verify(signalAnalyzer, never()).estimateKey(any(File.class));
    }

    @Test
    void analysisFailureShouldDowngradeToUnknownValues() throws Exception {
        Path mp3 = tempDir.resolve("untagged.mp3");
        Files.write(mp3, new byte[4096]);
        when(audioTagReader.read(any(File.class), eq(AudioContainer.MP3))).thenReturn(new TagData());
        when(signalAnalyzer.estimateTempo(any(File.class))).thenThrow(new AnalysisException("no decoder"));
        when(signalAnalyzer.estimateKey(any(File.class))).thenThrow(new AnalysisException("no decoder"));
        when(signalAnalyzer.estimateEnergy(any(File.class))).thenThrow(new IllegalStateException("boom"));

        Track track = resolver.resolve(mp3);

        assertFalse(track.isCorrupt());
        assertEquals("untagged", track.getTitle());
        assertEquals(0D, track.getBpm());
        assertEquals(KeyNames.UNKNOWN, track.getKey());
        assertEquals(0, track.getEnergy());
    }

    @Test
    void tagReaderExceptionShouldNameContainer() throws Exception {
        Path m4a = tempDir.resolve("clip.m4a");
        Files.write(m4a, new byte[4096]);
        when(audioTagReader.read(any(File.class), eq(AudioContainer.MP4)))
                .thenThrow(new IllegalStateException("no moov atom"));

        Track track = resolver.resolve(m4a);

        assertTrue(track.isCorrupt());
        assertEquals("Invalid MP4 file: no moov atom", track.getErrorMessage());
        verifyNoInteractions(signalAnalyzer);
    }
}
