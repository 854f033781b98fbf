package com.example.cratebridge.infrastructure.format.rekordbox;

import com.example.cratebridge.common.config.AppMigrationProperties;
import com.example.cratebridge.common.util.KeyNames;
import com.example.cratebridge.domain.enumtype.AudioContainer;
import com.example.cratebridge.domain.enumtype.CueType;
import com.example.cratebridge.domain.enumtype.LibraryFormat;
import com.example.cratebridge.domain.enumtype.SkipReason;
import com.example.cratebridge.domain.model.CueMarker;
import com.example.cratebridge.domain.model.IdentityAssignment;
import com.example.cratebridge.domain.model.LibraryDocument;
import com.example.cratebridge.domain.model.Playlist;
import com.example.cratebridge.domain.model.Track;
import com.example.cratebridge.infrastructure.format.DocumentFiles;
import com.example.cratebridge.infrastructure.format.FieldValues;
import com.example.cratebridge.infrastructure.format.LibraryCodec;
import com.example.cratebridge.infrastructure.format.LocationUris;
import com.example.cratebridge.infrastructure.format.XmlMappers;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * rekordbox XML collection documents.
 */
@Component
public class RekordboxXmlLibraryCodec implements LibraryCodec {

    private static final Logger log = LoggerFactory.getLogger(RekordboxXmlLibraryCodec.class);

    static final String DOCUMENT_VERSION = "1.0.0";

    static final int MARK_HOT_CUE = 0;
    static final int MARK_LOOP = 1;
    static final int MARK_MEMORY = 2;
    static final int MARK_GRID = 4;

    private final XmlMapper mapper = XmlMappers.create();
    private final AppMigrationProperties migrationProperties;

    public RekordboxXmlLibraryCodec(AppMigrationProperties migrationProperties) {
        this.migrationProperties = migrationProperties;
    }

    @Override
    public LibraryFormat format() {
        return LibraryFormat.REKORDBOX_XML;
    }

    // ════════════════════════════════════════════════════════
    // Read
    // ════════════════════════════════════════════════════════

    @Override
    public LibraryDocument read(Path source) throws IOException {
        RekordboxDocument document = XmlMappers.readDocument(mapper, source, RekordboxDocument.class, "rekordbox XML");
        LibraryDocument result = new LibraryDocument();
        Map<String, Track> byId = new HashMap<>();

        List<RekordboxTrack> entries = document.getCollection() == null || document.getCollection().getTracks() == null
                ? new ArrayList<RekordboxTrack>() : document.getCollection().getTracks();
        int index = 0;
        for (RekordboxTrack entry : entries) {
            index++;
            String ref = FieldValues.isBlank(entry.getTrackId()) ? "TRACK#" + index : entry.getTrackId().trim();
            if (FieldValues.isBlank(entry.getTrackId())) {
                skip(result, ref, SkipReason.MISSING_REQUIRED_FIELD, "missing TrackID");
                continue;
            }
            if (FieldValues.isBlank(entry.getLocation())) {
                skip(result, ref, SkipReason.MISSING_REQUIRED_FIELD, "missing Location");
                continue;
            }
            if (byId.containsKey(ref)) {
                skip(result, ref, SkipReason.DUPLICATE_IDENTITY, "TrackID already used by an earlier track");
                continue;
            }
            Track track = toTrack(ref, entry, result);
            byId.put(ref, track);
            result.getTracks().add(track);
        }

        if (document.getPlaylists() != null && document.getPlaylists().getNodes() != null) {
            for (RekordboxNode root : document.getPlaylists().getNodes()) {
                if (RekordboxNode.TYPE_FOLDER.equals(FieldValues.trimToEmpty(root.getType()))) {
                    // the top folder is the implicit ROOT and does not appear in folder paths
                    for (RekordboxNode child : children(root)) {
                        collectPlaylists(child, new ArrayList<String>(), byId, result);
                    }
                } else {
                    collectPlaylists(root, new ArrayList<String>(), byId, result);
                }
            }
        }
        log.info("REKORDBOX_READ source={} tracks={} playlists={} skipped={}",
                source, result.getTracks().size(), result.getPlaylists().size(), result.getSkipped().size());
        return result;
    }

    private Track toTrack(String id, RekordboxTrack entry, LibraryDocument result) {
        Track track = new Track();
        track.setSourceId(id);
        track.setFilePath(LocationUris.toFilePath(entry.getLocation()));
        track.setTitle(FieldValues.trimToEmpty(entry.getName()));
        track.setArtist(FieldValues.trimToEmpty(entry.getArtist()));
        track.setAlbum(FieldValues.trimToEmpty(entry.getAlbum()));
        track.setGenre(FieldValues.trimToEmpty(entry.getGenre()));
        track.setYear(FieldValues.trimToEmpty(entry.getYear()));
        track.setComment(FieldValues.trimToEmpty(entry.getComments()));
        Double bpm = FieldValues.parseDouble(entry.getAverageBpm());
        if (bpm != null && bpm > 0) {
            track.setBpm(bpm);
        }
        Double totalTime = FieldValues.parseDouble(entry.getTotalTime());
        if (totalTime != null && totalTime > 0) {
            track.setDuration(totalTime);
        }
        track.setKey(KeyNames.normalize(entry.getTonality()));
        if (entry.getPositionMarks() != null) {
            for (RekordboxTrack.PositionMark mark : entry.getPositionMarks()) {
                CueMarker marker = toMarker(mark);
                if (marker == null) {
                    skip(result, id, SkipReason.UNSUPPORTED_CUE_TYPE, "POSITION_MARK Type=" + mark.getType());
                } else {
                    track.getCuePoints().add(marker);
                }
            }
        }
        track.applyDefaults();
        return track;
    }

    private CueMarker toMarker(RekordboxTrack.PositionMark mark) {
        Integer code = FieldValues.parseInt(mark.getType());
        Double start = FieldValues.parseDouble(mark.getStart());
        if (code == null || start == null) {
            return null;
        }
        CueType type;
        switch (code) {
            case MARK_HOT_CUE:
                type = CueType.HOT_CUE;
                break;
            case MARK_LOOP:
                type = CueType.LOOP;
                break;
            case MARK_MEMORY:
                type = CueType.MEMORY_CUE;
                break;
            case MARK_GRID:
                type = CueType.GRID;
                break;
            default:
                return null;
        }
        Integer num = FieldValues.parseInt(mark.getNum());
        Double end = FieldValues.parseDouble(mark.getEnd());
        double length = end != null && end > start ? end - start : 0D;
        int slot = type == CueType.HOT_CUE && num != null && num >= 0 ? num : CueMarker.NO_SLOT;
        return new CueMarker(type, start, FieldValues.trimToEmpty(mark.getName()), slot, length);
    }

    private void collectPlaylists(RekordboxNode node, List<String> folderPath, Map<String, Track> byId,
                                  LibraryDocument result) {
        String type = FieldValues.trimToEmpty(node.getType());
        String name = FieldValues.trimToEmpty(node.getName());
        if (RekordboxNode.TYPE_FOLDER.equals(type)) {
            List<String> nested = new ArrayList<>(folderPath);
            nested.add(name);
            for (RekordboxNode child : children(node)) {
                collectPlaylists(child, nested, byId, result);
            }
        } else if (RekordboxNode.TYPE_PLAYLIST.equals(type)) {
            Playlist playlist = new Playlist(name, folderPath);
            if (node.getTracks() != null) {
                for (RekordboxNode.TrackRef ref : node.getTracks()) {
                    Track track = byId.get(FieldValues.trimToEmpty(ref.getKey()));
                    if (track == null) {
                        skip(result, name, SkipReason.UNRESOLVED_REFERENCE, "Key=" + ref.getKey());
                    } else {
                        playlist.getTracks().add(track);
                    }
                }
            }
            result.getPlaylists().add(playlist);
        } else {
            log.debug("REKORDBOX_NODE_IGNORED type={} name={}", type, name);
        }
    }

    private static List<RekordboxNode> children(RekordboxNode node) {
        return node.getChildren() == null ? new ArrayList<RekordboxNode>() : node.getChildren();
    }

    private static void skip(LibraryDocument result, String ref, SkipReason reason, String detail) {
        result.skip(ref, reason, detail);
        log.debug("CODEC_ENTRY_SKIPPED format=REKORDBOX_XML entry={} reason={} detail={}", ref, reason, detail);
    }

    // ════════════════════════════════════════════════════════
    // Write
    // ════════════════════════════════════════════════════════

    @Override
    public IdentityAssignment write(Path target, List<Track> tracks, List<Playlist> playlists) throws IOException {
        IdentityAssignment assignment = new IdentityAssignment();
        RekordboxDocument document = new RekordboxDocument();
        document.setVersion(DOCUMENT_VERSION);

        RekordboxDocument.Product product = new RekordboxDocument.Product();
        product.setName(migrationProperties.getRekordboxProductName());
        product.setVersion(migrationProperties.getRekordboxProductVersion());
        product.setCompany(migrationProperties.getRekordboxCompany());
        document.setProduct(product);

        RekordboxDocument.Collection collection = new RekordboxDocument.Collection();
        int nextId = 1;
        for (Track track : tracks) {
            if (assignment.contains(track)) {
                continue;
            }
            String id = String.valueOf(nextId++);
            assignment.assign(track, id);
            collection.getTracks().add(toEntry(id, track));
        }
        collection.setEntryCount(String.valueOf(collection.getTracks().size()));
        document.setCollection(collection);

        RekordboxNode root = RekordboxNode.folder("ROOT");
        Map<String, RekordboxNode> folders = new LinkedHashMap<>();
        for (Playlist playlist : playlists) {
            RekordboxNode node = RekordboxNode.playlist(playlist.getName());
            for (Track track : playlist.getTracks()) {
                String id = assignment.idOf(track);
                if (id == null) {
                    assignment.recordDroppedPlaylistReference();
                    continue;
                }
                node.getTracks().add(new RekordboxNode.TrackRef(id));
            }
            node.setEntryCount(String.valueOf(node.getTracks().size()));
            parentFor(playlist.getFolderPath(), root, folders).getChildren().add(node);
        }
        root.setCount(String.valueOf(root.getChildren().size()));
        for (RekordboxNode folder : folders.values()) {
            folder.setCount(String.valueOf(folder.getChildren().size()));
        }
        RekordboxDocument.Playlists playlistSection = new RekordboxDocument.Playlists();
        playlistSection.getNodes().add(root);
        document.setPlaylists(playlistSection);

        DocumentFiles.writeAtomically(target, out -> mapper.writeValue(out, document));
        log.info("REKORDBOX_WRITTEN target={} tracks={} playlists={} droppedPlaylistRefs={}",
                target, assignment.size(), playlists.size(), assignment.getDroppedPlaylistReferences());
        return assignment;
    }

    private RekordboxNode parentFor(List<String> folderPath, RekordboxNode root, Map<String, RekordboxNode> folders) {
        RekordboxNode parent = root;
        StringBuilder pathKey = new StringBuilder();
        for (String folderName : folderPath) {
            pathKey.append('/').append(folderName);
            RekordboxNode folder = folders.get(pathKey.toString());
            if (folder == null) {
                folder = RekordboxNode.folder(folderName);
                folders.put(pathKey.toString(), folder);
                parent.getChildren().add(folder);
            }
            parent = folder;
        }
        return parent;
    }

    private RekordboxTrack toEntry(String id, Track track) {
        RekordboxTrack entry = new RekordboxTrack();
        entry.setTrackId(id);
        entry.setName(track.getTitle());
        entry.setArtist(track.getArtist());
        entry.setAlbum(track.getAlbum());
        entry.setGenre(track.getGenre());
        entry.setKind(kindOf(track.getFilePath()));
        entry.setSize(String.valueOf(sizeOf(track.getFilePath())));
        entry.setTotalTime(String.valueOf(Math.round(track.getDuration())));
        entry.setYear(track.getYear());
        entry.setAverageBpm(FieldValues.formatDecimal(track.getBpm(), 2));
        entry.setComments(track.getComment());
        entry.setRating("0");
        entry.setLocation(LocationUris.toLocation(track.getFilePath() == null ? "" : track.getFilePath()));
        entry.setTonality(KeyNames.isKnown(track.getKey()) ? track.getKey() : "");

        if (track.getBpm() > 0) {
            RekordboxTrack.Tempo tempo = new RekordboxTrack.Tempo();
            tempo.setStart("0.000");
            tempo.setBpm(FieldValues.formatDecimal(track.getBpm(), 2));
            tempo.setMeter("4/4");
            tempo.setBeat("1");
            entry.getTempos().add(tempo);
        }

        int nextSlot = 0;
        for (CueMarker marker : track.getCuePoints()) {
            RekordboxTrack.PositionMark mark = toMark(marker, nextSlot);
            if (marker.getType() == CueType.HOT_CUE) {
                nextSlot = Math.max(nextSlot, Integer.parseInt(mark.getNum()) + 1);
            }
            entry.getPositionMarks().add(mark);
        }
        return entry;
    }

    private RekordboxTrack.PositionMark toMark(CueMarker marker, int nextSlot) {
        RekordboxTrack.PositionMark mark = new RekordboxTrack.PositionMark();
        String label = marker.getLabel() == null ? "" : marker.getLabel();
        int num = -1;
        switch (marker.getType()) {
            case HOT_CUE:
                mark.setType(String.valueOf(MARK_HOT_CUE));
                num = marker.getHotCueSlot() >= 0 ? marker.getHotCueSlot() : nextSlot;
                color(mark, 255, 0, 0);
                break;
            case MEMORY_CUE:
                mark.setType(String.valueOf(MARK_MEMORY));
                color(mark, 0, 0, 255);
                break;
            case LOOP:
                mark.setType(String.valueOf(MARK_LOOP));
                mark.setEnd(FieldValues.formatDecimal(marker.getStartSeconds() + marker.getLengthSeconds(), 3));
                color(mark, 0, 255, 0);
                break;
            default:
                mark.setType(String.valueOf(MARK_GRID));
                label = "Grid";
                color(mark, 0, 0, 0);
                break;
        }
        mark.setName(label);
        mark.setStart(FieldValues.formatDecimal(marker.getStartSeconds(), 3));
        mark.setNum(String.valueOf(num));
        return mark;
    }

    private static void color(RekordboxTrack.PositionMark mark, int red, int green, int blue) {
        mark.setRed(String.valueOf(red));
        mark.setGreen(String.valueOf(green));
        mark.setBlue(String.valueOf(blue));
    }

    static String kindOf(String filePath) {
        if (filePath == null) {
            return "MP3 File";
        }
        try {
            switch (AudioContainer.extensionOf(Paths.get(filePath))) {
                case "flac":
                    return "FLAC File";
                case "wav":
                    return "WAV File";
                case "m4a":
                    return "M4A File";
                case "aac":
                    return "AAC File";
                default:
                    return "MP3 File";
            }
        } catch (InvalidPathException e) {
            return "MP3 File";
        }
    }

    private static long sizeOf(String filePath) {
        if (filePath == null) {
            return 0L;
        }
        try {
            Path path = Paths.get(filePath);
            return Files.isRegularFile(path) ? Files.size(path) : 0L;
        } catch (InvalidPathException | IOException e) {
            log.debug("Size unavailable for {}: {}", filePath, e.getMessage());
            return 0L;
        }
    }
}
