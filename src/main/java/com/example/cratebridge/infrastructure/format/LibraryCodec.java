package com.example.cratebridge.infrastructure.format;

import com.example.cratebridge.domain.enumtype.LibraryFormat;
import com.example.cratebridge.domain.model.IdentityAssignment;
import com.example.cratebridge.domain.model.LibraryDocument;
import com.example.cratebridge.domain.model.Playlist;
import com.example.cratebridge.domain.model.Track;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reader/writer pair for one foreign library format.
 *
 * <p>Instances are not safe for concurrent use against the same document; callers serialize access.
 */
public interface LibraryCodec {

    LibraryFormat format();

    /**
     * Parses a document into tracks and playlists. Entries missing required fields are skipped one by one and
     * reported in {@link LibraryDocument#getSkipped()}; referenced audio files are not checked here.
     *
     * @throws com.example.cratebridge.common.exception.LibraryException when the document cannot be parsed at all
     */
    LibraryDocument read(Path source) throws IOException;

    /**
     * Regenerates {@code target} from the given model. Tracks are serialized before playlists, and playlist
     * entries whose track was not written are dropped.
     *
     * @return the identity minted for each written track
     */
    IdentityAssignment write(Path target, List<Track> tracks, List<Playlist> playlists) throws IOException;
}
