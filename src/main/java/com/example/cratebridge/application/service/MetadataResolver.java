package com.example.cratebridge.application.service;

import com.example.cratebridge.common.config.AppScanProperties;
import com.example.cratebridge.common.util.KeyNames;
import com.example.cratebridge.domain.enumtype.AudioContainer;
import com.example.cratebridge.domain.model.TagData;
import com.example.cratebridge.domain.model.Track;
import com.example.cratebridge.infrastructure.analysis.AnalysisException;
import com.example.cratebridge.infrastructure.analysis.SignalAnalyzer;
import com.example.cratebridge.infrastructure.parser.AudioTagReader;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns a file path into a {@link Track}. Never throws: every failure ends up in {@code corrupt}/{@code errorMessage}
 * or as an "unknown" analytic value.
 *
 * <p>Checks run in order: existence, size, container header, decode. Signal analysis only sees files that
 * passed all of them.
 */
@Service
public class MetadataResolver {

    private static final Logger log = LoggerFactory.getLogger(MetadataResolver.class);

    private final AudioTagReader audioTagReader;
    private final SignalAnalyzer signalAnalyzer;
    private final MetadataFallbackService metadataFallbackService;
    private final AppScanProperties appScanProperties;

    public MetadataResolver(AudioTagReader audioTagReader,
                            SignalAnalyzer signalAnalyzer,
                            MetadataFallbackService metadataFallbackService,
                            AppScanProperties appScanProperties) {
        this.audioTagReader = audioTagReader;
        this.signalAnalyzer = signalAnalyzer;
        this.metadataFallbackService = metadataFallbackService;
        this.appScanProperties = appScanProperties;
    }

    public Track resolve(Path path) {
        String filePath = path.toAbsolutePath().normalize().toString();
        try {
            return doResolve(path, filePath);
        } catch (RuntimeException e) {
            log.error("METADATA_RESOLVE_FAILED path={}", filePath, e);
            return Track.corrupt(filePath, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private Track doResolve(Path path, String filePath) {
        if (!Files.exists(path)) {
            log.warn("TRACK_CORRUPT path={} reason=missing", filePath);
            return Track.corrupt(filePath, "File does not exist");
        }
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            log.warn("TRACK_CORRUPT path={} reason=unreadable", filePath);
            return Track.corrupt(filePath, "File is not readable");
        }
        long size;
        try {
            size = Files.size(path);
        } catch (IOException e) {
            log.warn("TRACK_CORRUPT path={} reason=size-unavailable error={}", filePath, e.getMessage());
            return Track.corrupt(filePath, "File is not readable: " + e.getMessage());
        }
        if (size < appScanProperties.getMinFileSizeBytes()) {
            log.warn("TRACK_CORRUPT path={} reason=too-small size={}", filePath, size);
            return Track.corrupt(filePath, "File is too small (" + size + " bytes)");
        }

        AudioContainer container = AudioContainer.fromPath(path);
        if (container == null) {
            String extension = AudioContainer.extensionOf(path);
            log.warn("TRACK_CORRUPT path={} reason=unsupported-extension ext={}", filePath, extension);
            return Track.corrupt(filePath, "Unsupported audio format: ." + extension);
        }

        File file = path.toFile();
        TagData tags;
        try {
            tags = audioTagReader.read(file, container);
        } catch (Exception e) {
            String message = "Invalid " + container.name() + " file: " + e.getMessage();
            log.warn("TRACK_CORRUPT path={} reason=container-parse error={}", filePath, e.getMessage());
            return Track.corrupt(filePath, message);
        }

        Track track = new Track();
        track.setFilePath(filePath);
        metadataFallbackService.applyTags(track, tags);

        if (track.getBpm() <= 0) {
            track.setBpm(estimateTempo(file, filePath));
        }
        if (!KeyNames.isKnown(track.getKey())) {
            track.setKey(estimateKey(file, filePath));
        }
        track.setEnergy(estimateEnergy(file, filePath));
        log.debug("TRACK_RESOLVED path={} title='{}' artist='{}' bpm={} key={} energy={}",
                filePath, track.getTitle(), track.getArtist(), track.getBpm(), track.getKey(), track.getEnergy());
        return track;
    }

    private double estimateTempo(File file, String filePath) {
        try {
            return signalAnalyzer.estimateTempo(file);
        } catch (AnalysisException | RuntimeException e) {
            log.warn("ANALYSIS_UNAVAILABLE field=bpm path={} reason={}", filePath, e.getMessage());
            return 0D;
        }
    }

    private String estimateKey(File file, String filePath) {
        try {
            return signalAnalyzer.estimateKey(file);
        } catch (AnalysisException | RuntimeException e) {
            log.warn("ANALYSIS_UNAVAILABLE field=key path={} reason={}", filePath, e.getMessage());
            return KeyNames.UNKNOWN;
        }
    }

    private int estimateEnergy(File file, String filePath) {
        try {
            return Math.max(0, Math.min(100, signalAnalyzer.estimateEnergy(file)));
        } catch (AnalysisException | RuntimeException e) {
            log.warn("ANALYSIS_UNAVAILABLE field=energy path={} reason={}", filePath, e.getMessage());
            return 0;
        }
    }
}
