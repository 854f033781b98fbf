package com.example.cratebridge.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.cratebridge.common.config.AppScanProperties;
import com.example.cratebridge.common.exception.LibraryException;
import com.example.cratebridge.common.util.CancellationToken;
import com.example.cratebridge.domain.model.Track;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LibraryScanServiceTest {

    @TempDir
    Path tempDir;

    private MetadataResolver metadataResolver;
    private LibraryScanService service;

    @BeforeEach
    void setUp() {
        metadataResolver = mock(MetadataResolver.class);
        when(metadataResolver.resolve(any(Path.class)))
                .thenAnswer(invocation -> Track.withDefaults(invocation.getArgument(0).toString()));
        service = new LibraryScanService(metadataResolver, new AppScanProperties());
    }

    @Test
    void shouldFindSupportedFilesInSortedOrder() throws Exception {
        Path nested = Files.createDirectories(tempDir.resolve("house/deep"));
        audioFile(nested.resolve("b.flac"));
        audioFile(tempDir.resolve("a.mp3"));
        audioFile(tempDir.resolve("c.WAV"));
        audioFile(tempDir.resolve("notes.txt"));
        Files.write(tempDir.resolve("stub.mp3"), new byte[512]);

        ScanResult result = service.scan(Collections.singletonList(tempDir), ProgressListener.NONE,
                CancellationToken.none());

        assertFalse(result.isCanceled());
        assertEquals(3, result.getDiscoveredFiles());
        List<String> paths = new ArrayList<>();
        for (Track track : result.getTracks()) {
            paths.add(track.getFilePath());
        }
        List<String> sorted = new ArrayList<>(paths);
        Collections.sort(sorted);
        assertEquals(sorted, paths);
        assertTrue(paths.contains(tempDir.resolve("c.WAV").toAbsolutePath().normalize().toString()));
    }

    @Test
    void cancellationShouldKeepExactlyTheProcessedTracks() throws Exception {
        for (int i = 0; i < 100; i++) {
            audioFile(tempDir.resolve(String.format("track-%03d.mp3", i)));
        }
        CancellationToken token = new CancellationToken();
        AtomicInteger resolved = new AtomicInteger();
        when(metadataResolver.resolve(any(Path.class))).thenAnswer(invocation -> {
            if (resolved.incrementAndGet() == 10) {
                token.cancel();
            }
            return Track.withDefaults(invocation.getArgument(0).toString());
        });

        ScanResult result = service.scan(Collections.singletonList(tempDir), ProgressListener.NONE, token);

        assertTrue(result.isCanceled());
        assertEquals(10, result.getTracks().size());
        assertEquals(10, new HashSet<>(result.getTracks()).size());
        for (int i = 0; i < 10; i++) {
            assertTrue(result.getTracks().get(i).getFilePath().endsWith(String.format("track-%03d.mp3", i)));
        }
    }

    @Test
    void progressShouldBeMonotonicAndFinishAtHundred() throws Exception {
        for (int i = 0; i < 7; i++) {
            audioFile(tempDir.resolve("t" + i + ".mp3"));
        }
        List<Integer> percents = new ArrayList<>();

        service.scan(Collections.singletonList(tempDir),
                (percent, message, current, total) -> percents.add(percent), CancellationToken.none());

        for (int i = 1; i < percents.size(); i++) {
            assertTrue(percents.get(i) >= percents.get(i - 1), percents.toString());
        }
        assertEquals(100, percents.get(percents.size() - 1).intValue());
    }

    @Test
    void missingRootShouldFailWholeScan() {
        LibraryException error = assertThrows(LibraryException.class, () -> service.scan(
                Collections.singletonList(tempDir.resolve("nowhere")), ProgressListener.NONE, null));

        assertEquals(LibraryException.INPUT_MISSING, error.getCode());
    }

    private static void audioFile(Path path) throws Exception {
        Files.write(path, new byte[2048]);
    }
}
