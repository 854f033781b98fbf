package com.example.cratebridge.infrastructure.format.m3u;

import com.example.cratebridge.domain.enumtype.LibraryFormat;
import com.example.cratebridge.domain.enumtype.SkipReason;
import com.example.cratebridge.domain.model.IdentityAssignment;
import com.example.cratebridge.domain.model.LibraryDocument;
import com.example.cratebridge.domain.model.Playlist;
import com.example.cratebridge.domain.model.Track;
import com.example.cratebridge.infrastructure.format.DocumentFiles;
import com.example.cratebridge.infrastructure.format.FieldValues;
import com.example.cratebridge.infrastructure.format.LibraryCodec;
import com.example.cratebridge.infrastructure.format.LocationUris;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extended M3U playlists. {@code .m3u8} files are UTF-8, {@code .m3u} files ISO-8859-1; characters the legacy
 * charset cannot represent are written as {@code ?}.
 */
@Component
public class M3uPlaylistCodec implements LibraryCodec {

    private static final Logger log = LoggerFactory.getLogger(M3uPlaylistCodec.class);

    static final String HEADER = "#EXTM3U";
    static final String INFO_PREFIX = "#EXTINF:";
    static final int MAX_PARENT_SEGMENTS = 2;

    private static final String LINE_SEPARATOR = "\n";
    private static final String ARTIST_TITLE_SEPARATOR = " - ";

    @Override
    public LibraryFormat format() {
        return LibraryFormat.M3U;
    }

    public static Charset charsetFor(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".m3u8") ? StandardCharsets.UTF_8 : StandardCharsets.ISO_8859_1;
    }

    // ════════════════════════════════════════════════════════
    // Read
    // ════════════════════════════════════════════════════════

    @Override
    public LibraryDocument read(Path source) throws IOException {
        DocumentFiles.requireReadable(source, "Playlist");
        String content = new String(Files.readAllBytes(source), charsetFor(source));
        if (content.startsWith("\uFEFF")) {
            content = content.substring(1);
        }
        Path baseDirectory = source.toAbsolutePath().normalize().getParent();
        LibraryDocument result = new LibraryDocument();
        Playlist playlist = new Playlist(DocumentFiles.stem(source));

        String pendingInfo = null;
        Double pendingDuration = null;
        int lineNumber = 0;
        for (String rawLine : content.split("\\r?\\n|\\r")) {
            lineNumber++;
            String line = rawLine.trim();
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith(INFO_PREFIX)) {
                String info = line.substring(INFO_PREFIX.length());
                int comma = info.indexOf(',');
                pendingDuration = FieldValues.parseDouble(comma >= 0 ? info.substring(0, comma) : info);
                pendingInfo = comma >= 0 ? info.substring(comma + 1).trim() : null;
                continue;
            }
            if (line.startsWith("#")) {
                continue;
            }
            String filePath;
            try {
                filePath = resolve(baseDirectory, line);
            } catch (InvalidPathException e) {
                result.skip("line " + lineNumber, SkipReason.INVALID_VALUE, e.getMessage());
                log.debug("CODEC_ENTRY_SKIPPED format=M3U entry=line {} reason={}", lineNumber,
                        SkipReason.INVALID_VALUE);
                pendingInfo = null;
                pendingDuration = null;
                continue;
            }
            Track track = new Track();
            track.setFilePath(filePath);
            applyInfo(track, pendingInfo, pendingDuration);
            track.applyDefaults();
            result.getTracks().add(track);
            playlist.getTracks().add(track);
            pendingInfo = null;
            pendingDuration = null;
        }
        result.getPlaylists().add(playlist);
        log.info("M3U_READ source={} entries={} skipped={}", source, playlist.size(), result.getSkipped().size());
        return result;
    }

    private static String resolve(Path baseDirectory, String entry) {
        String value = entry.startsWith("file:") ? LocationUris.toFilePath(entry) : entry;
        Path path = Paths.get(value);
        if (!path.isAbsolute() && baseDirectory != null) {
            path = baseDirectory.resolve(path);
        }
        return path.normalize().toString();
    }

    private static void applyInfo(Track track, String info, Double duration) {
        if (duration != null && duration > 0) {
            track.setDuration(duration);
        }
        if (FieldValues.isBlank(info)) {
            return;
        }
        int separator = info.indexOf(ARTIST_TITLE_SEPARATOR);
        if (separator > 0) {
            track.setArtist(info.substring(0, separator).trim());
            track.setTitle(info.substring(separator + ARTIST_TITLE_SEPARATOR.length()).trim());
        } else {
            track.setTitle(info);
        }
    }

    // ════════════════════════════════════════════════════════
    // Write
    // ════════════════════════════════════════════════════════

    /**
     * Writes {@code tracks} in order; a playlist file holds exactly one list, so {@code playlists} is not used.
     * The identity of each track is the path reference written for it.
     */
    @Override
    public IdentityAssignment write(Path target, List<Track> tracks, List<Playlist> playlists) throws IOException {
        IdentityAssignment assignment = new IdentityAssignment();
        Path directory = target.toAbsolutePath().normalize().getParent();
        StringBuilder content = new StringBuilder(HEADER).append(LINE_SEPARATOR);
        for (Track track : tracks) {
            if (FieldValues.isBlank(track.getFilePath())) {
                continue;
            }
            String reference = referenceFor(directory, track.getFilePath());
            long seconds = track.getDuration() > 0 ? Math.round(track.getDuration()) : -1L;
            content.append(INFO_PREFIX).append(seconds).append(',')
                    .append(track.getArtist()).append(ARTIST_TITLE_SEPARATOR).append(track.getTitle())
                    .append(LINE_SEPARATOR)
                    .append(reference).append(LINE_SEPARATOR);
            if (!assignment.contains(track)) {
                assignment.assign(track, reference);
            }
        }
        byte[] bytes = content.toString().getBytes(charsetFor(target));
        DocumentFiles.writeAtomically(target, out -> out.write(bytes));
        log.info("M3U_WRITTEN target={} entries={} charset={}", target, tracks.size(), charsetFor(target).name());
        return assignment;
    }

    /**
     * Path relative to {@code directory} when it needs at most two parent steps, otherwise the absolute path.
     */
    static String referenceFor(Path directory, String filePath) {
        Path path;
        try {
            path = Paths.get(filePath);
        } catch (InvalidPathException e) {
            return filePath;
        }
        if (!path.isAbsolute() || directory == null) {
            return filePath;
        }
        Path absolute = path.normalize();
        if (absolute.getRoot() == null || !absolute.getRoot().equals(directory.getRoot())) {
            return absolute.toString();
        }
        Path relative = directory.relativize(absolute);
        int parents = 0;
        for (Path segment : relative) {
            if ("..".equals(segment.toString())) {
                parents++;
            }
        }
        return parents > MAX_PARENT_SEGMENTS ? absolute.toString() : relative.toString();
    }
}
