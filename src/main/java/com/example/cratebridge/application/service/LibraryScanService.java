package com.example.cratebridge.application.service;

import com.example.cratebridge.common.config.AppScanProperties;
import com.example.cratebridge.common.exception.LibraryException;
import com.example.cratebridge.common.util.CancellationToken;
import com.example.cratebridge.domain.enumtype.AudioContainer;
import com.example.cratebridge.domain.model.Track;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Walks scan roots and resolves every audio file found into a {@link Track}.
 */
@Service
public class LibraryScanService {

    private static final Logger log = LoggerFactory.getLogger(LibraryScanService.class);

    private final MetadataResolver metadataResolver;
    private final AppScanProperties appScanProperties;

    public LibraryScanService(MetadataResolver metadataResolver, AppScanProperties appScanProperties) {
        this.metadataResolver = metadataResolver;
        this.appScanProperties = appScanProperties;
    }

    public ScanResult scan(List<Path> roots, ProgressListener listener, CancellationToken cancellation) {
        CancellationToken token = cancellation == null ? CancellationToken.none() : cancellation;
        for (Path root : roots) {
            if (!Files.isDirectory(root)) {
                throw LibraryException.inputMissing("Scan folder", root);
            }
        }
        long startMs = System.currentTimeMillis();
        ProgressTracker tracker = new ProgressTracker("SCAN", listener, appScanProperties.getProgressLogIntervalFiles());
        ScanResult result = new ScanResult();
        log.info("SCAN_START roots={} extensions={}", roots.size(), appScanProperties.normalizedAudioExtensions());

        // ════════════════════════════════════════════════════════
        // Phase 1: Discovery
        // ════════════════════════════════════════════════════════
        tracker.report(0, "Discovering audio files");
        List<Path> files = new ArrayList<>();
        for (Path root : roots) {
            if (token.isCancellationRequested()) {
                return canceled(result, tracker, startMs);
            }
            discover(root, token, files);
        }
        if (token.isCancellationRequested()) {
            return canceled(result, tracker, startMs);
        }
        Collections.sort(files);
        result.setDiscoveredFiles(files.size());
        log.info("SCAN_DISCOVERED totalFiles={}", files.size());

        // ════════════════════════════════════════════════════════
        // Phase 2: Resolve
        // ════════════════════════════════════════════════════════
        int total = files.size();
        int current = 0;
        for (Path file : files) {
            if (token.isCancellationRequested()) {
                return canceled(result, tracker, startMs);
            }
            Track track = metadataResolver.resolve(file);
            result.getTracks().add(track);
            current++;
            if (track.isCorrupt()) {
                result.setCorruptTracks(result.getCorruptTracks() + 1);
                tracker.onItemFailed();
            }
            tracker.onItemProcessed();
            tracker.report(total == 0 ? 100 : current * 100 / total,
                    "Scanned " + track.fileName(), current, total);
        }
        tracker.report(100, "Scan complete", current, total);
        result.setDurationMs(System.currentTimeMillis() - startMs);
        log.info("SCAN_FINISH total={} tracks={} corrupt={} elapsed={}",
                total, result.getTracks().size(), result.getCorruptTracks(),
                tracker.formatElapsed(result.getDurationMs()));
        return result;
    }

    private void discover(Path root, CancellationToken token, List<Path> files) {
        Set<String> extensions = appScanProperties.normalizedAudioExtensions();
        long minSize = appScanProperties.getMinFileSizeBytes();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    return token.isCancellationRequested() ? FileVisitResult.TERMINATE : FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (token.isCancellationRequested()) {
                        return FileVisitResult.TERMINATE;
                    }
                    if (attrs.isRegularFile()
                            && attrs.size() >= minSize
                            && extensions.contains(AudioContainer.extensionOf(file))) {
                        files.add(file.toAbsolutePath().normalize());
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.warn("SCAN_VISIT_FAILED path={} reason={}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new LibraryException(LibraryException.INPUT_MISSING,
                    "Scan folder could not be read: " + root, "Check folder permissions", e);
        }
    }

    private ScanResult canceled(ScanResult result, ProgressTracker tracker, long startMs) {
        result.setCanceled(true);
        result.setDurationMs(System.currentTimeMillis() - startMs);
        log.info("SCAN_CANCELED processed={} discovered={} elapsed={}",
                result.getTracks().size(), result.getDiscoveredFiles(),
                tracker.formatElapsed(result.getDurationMs()));
        return result;
    }
}
