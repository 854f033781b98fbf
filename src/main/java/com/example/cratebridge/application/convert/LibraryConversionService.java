package com.example.cratebridge.application.convert;

import com.example.cratebridge.domain.model.IdentityAssignment;
import com.example.cratebridge.domain.model.LibraryDocument;
import com.example.cratebridge.domain.model.Track;
import com.example.cratebridge.infrastructure.format.LibraryCodecs;
import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Direct document-to-document conversion between Traktor NML and rekordbox XML.
 */
@Service
public class LibraryConversionService {

    private static final Logger log = LoggerFactory.getLogger(LibraryConversionService.class);

    private final LibraryCodecs codecs;
    private final CueRemapper cueRemapper;

    public LibraryConversionService(LibraryCodecs codecs, CueRemapper cueRemapper) {
        this.codecs = codecs;
        this.cueRemapper = cueRemapper;
    }

    public ConversionReport convert(Path source, Path target, ConversionDirection direction,
                                    ConversionOptions options) throws IOException {
        ConversionOptions effective = options == null ? ConversionOptions.defaults() : options;
        log.info("CONVERSION_START direction={} source={} target={} mapFirstHotCueToMemory={} mapMemoryToHotCue={}",
                direction, source, target, effective.isMapFirstHotCueToMemory(), effective.isMapMemoryToHotCue());
        long startMs = System.currentTimeMillis();

        LibraryDocument document = codecs.codecFor(direction.getSourceFormat()).read(source);
        for (Track track : document.getTracks()) {
            remapCues(track, direction, effective);
        }
        IdentityAssignment assignment = codecs.codecFor(direction.getTargetFormat())
                .write(target, document.getTracks(), document.getPlaylists());

        ConversionReport report = new ConversionReport();
        report.setDirection(direction);
        report.setTrackCount(assignment.size());
        report.setPlaylistCount(document.getPlaylists().size());
        report.setDroppedPlaylistReferences(assignment.getDroppedPlaylistReferences());
        report.setIdentityTable(IdentityRemapTable.from(assignment));
        report.setSkipped(document.getSkipped());
        log.info("CONVERSION_DONE direction={} tracks={} playlists={} skipped={} durationMs={}",
                direction, report.getTrackCount(), report.getPlaylistCount(), report.getSkipped().size(),
                System.currentTimeMillis() - startMs);
        return report;
    }

    /**
     * Replaces the track's cue list with the mapping for the given direction.
     */
    public void remapCues(Track track, ConversionDirection direction, ConversionOptions options) {
        if (direction == ConversionDirection.NML_TO_REKORDBOX) {
            track.setCuePoints(cueRemapper.toRekordbox(track.getCuePoints(), options.isMapFirstHotCueToMemory()));
        } else {
            track.setCuePoints(cueRemapper.toNml(track.getCuePoints(), options.isMapMemoryToHotCue()));
        }
    }
}
