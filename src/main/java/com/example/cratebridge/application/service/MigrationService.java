package com.example.cratebridge.application.service;

import com.example.cratebridge.application.convert.ConversionDirection;
import com.example.cratebridge.application.convert.ConversionOptions;
import com.example.cratebridge.application.convert.LibraryConversionService;
import com.example.cratebridge.common.util.CancellationToken;
import com.example.cratebridge.domain.enumtype.CueRetention;
import com.example.cratebridge.domain.enumtype.LibraryFormat;
import com.example.cratebridge.domain.enumtype.MigrationPhase;
import com.example.cratebridge.domain.enumtype.MissingFileHandling;
import com.example.cratebridge.domain.enumtype.SkipReason;
import com.example.cratebridge.domain.model.CueMarker;
import com.example.cratebridge.domain.model.EntrySkip;
import com.example.cratebridge.domain.model.IdentityAssignment;
import com.example.cratebridge.domain.model.LibraryDocument;
import com.example.cratebridge.domain.model.Track;
import com.example.cratebridge.infrastructure.format.LibraryCodecs;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Moves a library document from one format to another, applying the missing-file and cue policies per track.
 *
 * <p>Per track the order is: resolve a missing file, remap cues (NML and rekordbox pairs only), trim cues.
 * Nothing is written until every track has been processed.
 */
@Service
public class MigrationService {

    private static final Logger log = LoggerFactory.getLogger(MigrationService.class);

    private final LibraryCodecs codecs;
    private final ScanFolderRegistry scanFolderRegistry;
    private final LibraryConversionService libraryConversionService;

    public MigrationService(LibraryCodecs codecs,
                            ScanFolderRegistry scanFolderRegistry,
                            LibraryConversionService libraryConversionService) {
        this.codecs = codecs;
        this.scanFolderRegistry = scanFolderRegistry;
        this.libraryConversionService = libraryConversionService;
    }

    public MigrationResult migrate(Path sourcePath, Path targetPath,
                                   LibraryFormat sourceFormat, LibraryFormat targetFormat,
                                   MigrationOptions options, ProgressListener listener,
                                   CancellationToken cancellation) throws IOException {
        MigrationOptions effective = options == null ? MigrationOptions.defaults() : options;
        CancellationToken token = cancellation == null ? CancellationToken.none() : cancellation;
        MigrationJob job = new MigrationJob(UUID.randomUUID().toString().substring(0, 8));
        ProgressTracker tracker = new ProgressTracker("MIGRATION", listener);
        log.info("MIGRATION_START jobId={} source={} sourceFormat={} target={} targetFormat={} cueRetention={} missingFiles={}",
                job.getJobId(), sourcePath, sourceFormat, targetPath, targetFormat,
                effective.getCueRetention(), effective.getMissingFileHandling());

        if (token.isCancellationRequested()) {
            return cancel(job, 0);
        }

        // ════════════════════════════════════════════════════════
        // Phase 1: Reading
        // ════════════════════════════════════════════════════════
        job.transitionTo(MigrationPhase.READING);
        tracker.report(MigrationPhase.READING.getStartPercent(), "Reading " + sourcePath.getFileName());
        LibraryDocument document = codecs.codecFor(sourceFormat).read(sourcePath);
        MigrationResult result = new MigrationResult();
        result.setTracksRead(document.getTracks().size());
        result.getSkipped().addAll(document.getSkipped());
        int total = document.getTracks().size();
        tracker.report(MigrationPhase.READING.getEndPercent(), "Read " + total + " tracks", total, total);

        // ════════════════════════════════════════════════════════
        // Phase 2: Processing
        // ════════════════════════════════════════════════════════
        job.transitionTo(MigrationPhase.PROCESSING);
        ConversionDirection direction = ConversionDirection.between(sourceFormat, targetFormat);
        ConversionOptions conversionOptions = new ConversionOptions(
                effective.isMapFirstHotCueToMemory(), effective.isMapMemoryToHotCue());
        List<Track> kept = new ArrayList<>();
        int processed = 0;
        for (Track track : document.getTracks()) {
            if (token.isCancellationRequested()) {
                return cancel(job, processed);
            }
            if (resolveMissingFile(track, effective, result)) {
                if (direction != null) {
                    libraryConversionService.remapCues(track, direction, conversionOptions);
                }
                retainCues(track, effective.getCueRetention());
                kept.add(track);
                tracker.onItemProcessed();
            } else {
                tracker.onItemSkipped();
            }
            processed++;
            result.setTracksProcessed(processed);
            tracker.report(MigrationPhase.PROCESSING.percentAt(processed, total),
                    "Processed " + track.fileName(), processed, total);
        }

        if (token.isCancellationRequested()) {
            return cancel(job, processed);
        }

        // ════════════════════════════════════════════════════════
        // Phase 3: Writing
        // ════════════════════════════════════════════════════════
        job.transitionTo(MigrationPhase.WRITING);
        tracker.report(MigrationPhase.WRITING.getStartPercent(), "Writing " + targetPath.getFileName());
        IdentityAssignment assignment = codecs.codecFor(targetFormat).write(targetPath, kept, document.getPlaylists());
        result.setIdentities(assignment);
        result.setTracksWritten(assignment.size());
        result.setDroppedPlaylistReferences(assignment.getDroppedPlaylistReferences());
        tracker.report(MigrationPhase.WRITING.getEndPercent(), "Migration complete", kept.size(), total);

        job.transitionTo(MigrationPhase.DONE);
        result.setPhase(MigrationPhase.DONE);
        log.info("MIGRATION_FINISH jobId={} read={} written={} relocated={} skipped={} warnings={} elapsed={}",
                job.getJobId(), result.getTracksRead(), result.getTracksWritten(), result.getTracksRelocated(),
                result.getSkipped().size(), result.getWarnings().size(), tracker.formatElapsed(tracker.getElapsedMs()));
        return result;
    }

    /**
     * @return whether the track stays in the migration
     */
    boolean resolveMissingFile(Track track, MigrationOptions options, MigrationResult result) {
        if (LibraryService.fileExists(track.getFilePath())) {
            return true;
        }
        MissingFileHandling handling = options.getMissingFileHandling();
        if (handling == MissingFileHandling.ATTEMPT_TO_LOCATE) {
            Optional<Path> located = scanFolderRegistry.locate(track.fileName());
            if (located.isPresent()) {
                String relocated = located.get().toAbsolutePath().normalize().toString();
                log.info("MIGRATION_TRACK_RELOCATED from={} to={}", track.getFilePath(), relocated);
                track.setFilePath(relocated);
                result.setTracksRelocated(result.getTracksRelocated() + 1);
                return true;
            }
            handling = options.getNotLocatedFallback() == MissingFileHandling.INCLUDE_WITH_WARNING
                    ? MissingFileHandling.INCLUDE_WITH_WARNING : MissingFileHandling.SKIP;
        }
        if (handling == MissingFileHandling.INCLUDE_WITH_WARNING) {
            log.warn("MIGRATION_TRACK_MISSING path={} action=include", track.getFilePath());
            result.getWarnings().add(track.getFilePath());
            return true;
        }
        log.info("MIGRATION_TRACK_MISSING path={} action=skip", track.getFilePath());
        result.getSkipped().add(new EntrySkip(
                track.getSourceId() == null ? track.getFilePath() : track.getSourceId(),
                SkipReason.FILE_MISSING, track.getFilePath()));
        return false;
    }

    static void retainCues(Track track, CueRetention retention) {
        List<CueMarker> cues = track.getCuePoints();
        if (cues.size() > retention.getLimit()) {
            track.setCuePoints(new ArrayList<>(cues.subList(0, retention.getLimit())));
        }
    }

    private MigrationResult cancel(MigrationJob job, int processedSoFar) {
        job.transitionTo(MigrationPhase.CANCELED);
        log.info("MIGRATION_CANCELED jobId={} processed={}", job.getJobId(), processedSoFar);
        return MigrationResult.canceled(processedSoFar);
    }
}
