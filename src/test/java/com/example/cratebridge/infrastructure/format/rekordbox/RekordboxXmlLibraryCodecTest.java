package com.example.cratebridge.infrastructure.format.rekordbox;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.cratebridge.common.config.AppMigrationProperties;
import com.example.cratebridge.domain.enumtype.CueType;
import com.example.cratebridge.domain.enumtype.SkipReason;
import com.example.cratebridge.domain.model.CueMarker;
import com.example.cratebridge.domain.model.IdentityAssignment;
import com.example.cratebridge.domain.model.LibraryDocument;
import com.example.cratebridge.domain.model.Playlist;
import com.example.cratebridge.domain.model.Track;
import com.example.cratebridge.support.TestLibraries;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RekordboxXmlLibraryCodecTest {

    @TempDir
    Path tempDir;

    private RekordboxXmlLibraryCodec codec;

    @BeforeEach
    void setUp() {
        codec = new RekordboxXmlLibraryCodec(new AppMigrationProperties());
    }

    @Test
    void writeThenReadShouldKeepMetadataMarksAndPlaylistTree() throws Exception {
        Track first = TestLibraries.track("/Users/dj/Music/Acid Track.flac", "Acid Tracks", "Phuture", 119.9D, "F#");
        first.getCuePoints().add(new CueMarker(CueType.MEMORY_CUE, 0.5D, "Memory 1"));
        first.getCuePoints().add(TestLibraries.hotCue(16D, "Drop", 2));
        first.getCuePoints().add(new CueMarker(CueType.BEAT, 0.1D, "Beat"));
        first.getCuePoints().add(new CueMarker(CueType.LOOP, 32D, "Loop", CueMarker.NO_SLOT, 4D));
        Track second = TestLibraries.track("/Users/dj/Music/b.mp3", "B", "C", 0D, "Unknown");
        Playlist top = new Playlist("Top");
        top.getTracks().add(first);
        Playlist nested = new Playlist("Peak", Collections.singletonList("Club"));
        nested.getTracks().add(second);
        nested.getTracks().add(first);
        Path target = tempDir.resolve("rekordbox.xml");

        IdentityAssignment assignment = codec.write(target, Arrays.asList(first, second), Arrays.asList(top, nested));
        LibraryDocument document = codec.read(target);

        assertEquals("1", assignment.idOf(first));
        assertEquals("2", assignment.idOf(second));
        assertEquals(2, document.getTracks().size());
        Track readFirst = document.getTracks().get(0);
        assertEquals("1", readFirst.getSourceId());
        assertEquals("/Users/dj/Music/Acid Track.flac", readFirst.getFilePath());
        assertEquals("Acid Tracks", readFirst.getTitle());
        assertEquals(119.9D, readFirst.getBpm(), 1e-6);
        assertEquals("F#", readFirst.getKey());

        assertEquals(4, readFirst.getCuePoints().size());
        assertEquals(CueType.MEMORY_CUE, readFirst.getCuePoints().get(0).getType());
        CueMarker hot = readFirst.getCuePoints().get(1);
        assertEquals(CueType.HOT_CUE, hot.getType());
        assertEquals("Drop", hot.getLabel());
        assertEquals(2, hot.getHotCueSlot());
        CueMarker grid = readFirst.getCuePoints().get(2);
        assertEquals(CueType.GRID, grid.getType());
        assertEquals("Grid", grid.getLabel());
        assertEquals(4D, readFirst.getCuePoints().get(3).getLengthSeconds(), 1e-6);

        assertEquals(2, document.getPlaylists().size());
        Playlist readTop = document.getPlaylists().get(0);
        assertEquals("Top", readTop.getName());
        assertTrue(readTop.getFolderPath().isEmpty());
        Playlist readNested = document.getPlaylists().get(1);
        assertEquals(Collections.singletonList("Club"), readNested.getFolderPath());
        assertSame(document.getTracks().get(1), readNested.getTracks().get(0));
        assertSame(readFirst, readNested.getTracks().get(1));
    }

    @Test
    void documentShouldCarryLocationTempoAndRootNode() throws Exception {
        Track track = TestLibraries.track("/Music/a.mp3", "A", "B", 128D, "A");
        Path target = tempDir.resolve("out.xml");

        codec.write(target, Collections.singletonList(track), Collections.<Playlist>emptyList());
        String xml = new String(Files.readAllBytes(target), StandardCharsets.UTF_8);

        assertTrue(xml.contains("Location=\"file://localhost/Music/a.mp3\""), xml);
        assertTrue(xml.contains("Inizio=\"0.000\""), xml);
        assertTrue(xml.contains("Metro=\"4/4\""), xml);
        assertTrue(xml.contains("Name=\"ROOT\""), xml);
        assertTrue(xml.contains("Version=\"1.0.0\""), xml);
    }

    @Test
    void pathsWithPercentSignsAndEmojiShouldSurviveWriteThenRead() throws Exception {
        Track escaped = TestLibraries.track("/m/100%25 Pure.mp3", "Pure", "X", 0D, "Unknown");
        Track emoji = TestLibraries.track("/m/50% \uD83D\uDD25.mp3", "Fire", "Y", 0D, "Unknown");
        Path target = tempDir.resolve("paths.xml");

        codec.write(target, Arrays.asList(escaped, emoji), Collections.<Playlist>emptyList());
        String xml = new String(Files.readAllBytes(target), StandardCharsets.UTF_8);
        LibraryDocument document = codec.read(target);

        assertTrue(xml.contains("Location=\"file://localhost/m/100%2525%20Pure.mp3\""), xml);
        assertEquals("/m/100%25 Pure.mp3", document.getTracks().get(0).getFilePath());
        assertEquals("/m/50% \uD83D\uDD25.mp3", document.getTracks().get(1).getFilePath());
    }

    @Test
    void foreignDocumentShouldSkipIncompleteTracksAndDecodeLocations() throws Exception {
        Path source = tempDir.resolve("foreign.xml");
        String xml = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                + "<DJ_PLAYLISTS Version=\"1.0.0\"><PRODUCT Name=\"rekordbox\" Version=\"6.6.3\"/>"
                + "<COLLECTION Entries=\"3\">"
                + "<TRACK TrackID=\"10\" Name=\"Caf&#233;\" Artist=\"X\" AverageBpm=\"126.00\" Tonality=\"Fm\""
                + " Location=\"file://localhost/Users/dj/Caf%C3%A9%20Mix+Edit.mp3\">"
                + "<POSITION_MARK Name=\"\" Type=\"3\" Start=\"1.0\" Num=\"-1\"/></TRACK>"
                + "<TRACK TrackID=\"11\" Name=\"No location\"/>"
                + "<TRACK Name=\"No id\" Location=\"file://localhost/a.mp3\"/>"
                + "</COLLECTION><PLAYLISTS><NODE Type=\"0\" Name=\"ROOT\" Count=\"1\">"
                + "<NODE Name=\"Set\" Type=\"1\" KeyType=\"0\" Entries=\"2\"><TRACK Key=\"10\"/><TRACK Key=\"99\"/></NODE>"
                + "</NODE></PLAYLISTS></DJ_PLAYLISTS>";
        Files.write(source, xml.getBytes(StandardCharsets.UTF_8));

        LibraryDocument document = codec.read(source);

        assertEquals(1, document.getTracks().size());
        Track track = document.getTracks().get(0);
        assertEquals("/Users/dj/Café Mix+Edit.mp3", track.getFilePath());
        assertEquals("F", track.getKey());
        assertTrue(track.getCuePoints().isEmpty());
        assertEquals(2, document.countSkipped(SkipReason.MISSING_REQUIRED_FIELD));
        assertEquals(1, document.countSkipped(SkipReason.UNSUPPORTED_CUE_TYPE));
        assertEquals(1, document.countSkipped(SkipReason.UNRESOLVED_REFERENCE));
        assertEquals(1, document.getPlaylists().get(0).size());
    }

    @Test
    void kindShouldFollowExtension() {
        assertEquals("FLAC File", RekordboxXmlLibraryCodec.kindOf("/a/b.FLAC"));
        assertEquals("M4A File", RekordboxXmlLibraryCodec.kindOf("/a/b.m4a"));
        assertEquals("MP3 File", RekordboxXmlLibraryCodec.kindOf("/a/b.ogg"));
    }
}
