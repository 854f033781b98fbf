package com.example.cratebridge.application.service;

import com.example.cratebridge.common.exception.LibraryException;
import com.example.cratebridge.common.util.CancellationToken;
import com.example.cratebridge.common.util.KeyNames;
import com.example.cratebridge.domain.enumtype.LibraryFormat;
import com.example.cratebridge.domain.enumtype.SkipReason;
import com.example.cratebridge.domain.model.IdentityAssignment;
import com.example.cratebridge.domain.model.LibraryDocument;
import com.example.cratebridge.domain.model.Playlist;
import com.example.cratebridge.domain.model.Track;
import com.example.cratebridge.infrastructure.format.LibraryCodecs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * The in-memory library of the current session: scanned or imported tracks plus playlists over them.
 *
 * <p>One scan, import or migration runs at a time; mutating methods are synchronized.
 */
@Service
public class LibraryService {

    private static final Logger log = LoggerFactory.getLogger(LibraryService.class);

    private final LibraryScanService libraryScanService;
    private final ScanFolderRegistry scanFolderRegistry;
    private final LibraryCodecs codecs;

    private final List<Track> tracks = new ArrayList<>();
    private final List<Playlist> playlists = new ArrayList<>();

    public LibraryService(LibraryScanService libraryScanService,
                          ScanFolderRegistry scanFolderRegistry,
                          LibraryCodecs codecs) {
        this.libraryScanService = libraryScanService;
        this.scanFolderRegistry = scanFolderRegistry;
        this.codecs = codecs;
    }

    public boolean addFolder(Path folder) {
        return scanFolderRegistry.addFolder(folder);
    }

    /**
     * Scans every registered folder. The library is replaced only when the scan ran to completion.
     */
    public synchronized ScanResult scanRegisteredFolders(ProgressListener listener, CancellationToken cancellation) {
        ScanResult result = libraryScanService.scan(scanFolderRegistry.getFolders(), listener, cancellation);
        if (result.isCompleted()) {
            tracks.clear();
            tracks.addAll(result.getTracks());
            playlists.clear();
            log.info("LIBRARY_REPLACED source=scan tracks={}", tracks.size());
        } else {
            log.info("LIBRARY_KEPT reason=scan_canceled tracks={}", tracks.size());
        }
        return result;
    }

    public synchronized List<Track> getTracks() {
        return Collections.unmodifiableList(new ArrayList<>(tracks));
    }

    public synchronized List<Playlist> getPlaylists() {
        return Collections.unmodifiableList(new ArrayList<>(playlists));
    }

    // ════════════════════════════════════════════════════════
    // Query / cleanup
    // ════════════════════════════════════════════════════════

    /**
     * Every criterion is optional; {@code null} means "any". Genre matches case-insensitively, the BPM range is
     * inclusive and the key is compared after normalization.
     */
    public synchronized List<Track> filterTracks(String genre, Double bpmMin, Double bpmMax, String key) {
        String wantedKey = key == null ? null : KeyNames.normalize(key);
        return tracks.stream()
                .filter(track -> genre == null || genre.trim().equalsIgnoreCase(track.getGenre()))
                .filter(track -> bpmMin == null || track.getBpm() >= bpmMin)
                .filter(track -> bpmMax == null || track.getBpm() <= bpmMax)
                .filter(track -> key == null || (wantedKey != null && wantedKey.equals(track.getKey())))
                .collect(Collectors.toList());
    }

    /**
     * Drops corrupt tracks from the library and from every playlist.
     *
     * @return number of tracks removed
     */
    public synchronized int removeCorruptTracks() {
        int removed = 0;
        Iterator<Track> iterator = tracks.iterator();
        while (iterator.hasNext()) {
            if (iterator.next().isCorrupt()) {
                iterator.remove();
                removed++;
            }
        }
        for (Playlist playlist : playlists) {
            playlist.getTracks().removeIf(Track::isCorrupt);
        }
        log.info("LIBRARY_CORRUPT_REMOVED removed={} remaining={}", removed, tracks.size());
        return removed;
    }

    public synchronized Playlist createPlaylist(String name, List<Track> members) {
        if (name == null || name.trim().isEmpty()) {
            throw new LibraryException(LibraryException.INVALID_STATE, "Playlist name must not be blank");
        }
        Playlist playlist = new Playlist(name.trim());
        Set<Track> known = Collections.newSetFromMap(new IdentityHashMap<Track, Boolean>());
        known.addAll(tracks);
        for (Track track : members) {
            if (known.contains(track)) {
                playlist.getTracks().add(track);
            } else {
                log.warn("PLAYLIST_MEMBER_IGNORED playlist={} path={} reason=not_in_library", name, track.getFilePath());
            }
        }
        playlists.add(playlist);
        log.info("PLAYLIST_CREATED name={} tracks={}", playlist.getName(), playlist.size());
        return playlist;
    }

    // ════════════════════════════════════════════════════════
    // Import / export
    // ════════════════════════════════════════════════════════

    /**
     * Replaces the library with the document's content. Entries whose audio file is missing are skipped and
     * reported as {@link SkipReason#FILE_MISSING}.
     */
    public synchronized LibraryDocument importFrom(LibraryFormat format, Path source) throws IOException {
        LibraryDocument document = codecs.codecFor(format).read(source);
        List<Track> present = new ArrayList<>();
        for (Track track : document.getTracks()) {
            if (fileExists(track.getFilePath())) {
                present.add(track);
            } else {
                document.skip(track.getSourceId() == null ? track.getFilePath() : track.getSourceId(),
                        SkipReason.FILE_MISSING, track.getFilePath());
                log.info("IMPORT_TRACK_SKIPPED path={} reason=file_missing", track.getFilePath());
            }
        }
        Set<Track> kept = Collections.newSetFromMap(new IdentityHashMap<Track, Boolean>());
        kept.addAll(present);
        for (Playlist playlist : document.getPlaylists()) {
            playlist.getTracks().removeIf(track -> !kept.contains(track));
        }
        document.setTracks(present);

        tracks.clear();
        tracks.addAll(present);
        playlists.clear();
        playlists.addAll(document.getPlaylists());
        log.info("LIBRARY_REPLACED source={} format={} tracks={} playlists={} skipped={}",
                source, format, tracks.size(), playlists.size(), document.getSkipped().size());
        return document;
    }

    public synchronized IdentityAssignment exportTo(LibraryFormat format, Path target) throws IOException {
        IdentityAssignment assignment = codecs.codecFor(format).write(target, tracks, playlists);
        log.info("LIBRARY_EXPORTED target={} format={} tracks={} playlists={}",
                target, format, assignment.size(), playlists.size());
        return assignment;
    }

    /**
     * Writes one playlist as an M3U/M3U8 file.
     */
    public synchronized IdentityAssignment exportPlaylist(String name, Path target) throws IOException {
        Playlist playlist = playlists.stream()
                .filter(item -> item.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> new LibraryException(LibraryException.INVALID_STATE, "No playlist named " + name));
        return codecs.codecFor(LibraryFormat.M3U)
                .write(target, playlist.getTracks(), Collections.singletonList(playlist));
    }

    public PlaybackSource playbackSourceFor(Track track) {
        return PlaybackSource.of(track);
    }

    static boolean fileExists(String filePath) {
        if (filePath == null || filePath.trim().isEmpty()) {
            return false;
        }
        try {
            return Files.isRegularFile(Paths.get(filePath));
        } catch (InvalidPathException e) {
            return false;
        }
    }
}
