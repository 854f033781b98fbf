package com.example.cratebridge.infrastructure.format.nml;

import com.example.cratebridge.common.config.AppMigrationProperties;
import com.example.cratebridge.common.util.KeyNames;
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
import com.example.cratebridge.infrastructure.format.XmlMappers;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Traktor NML collection documents.
 */
@Component
public class NmlLibraryCodec implements LibraryCodec {

    private static final Logger log = LoggerFactory.getLogger(NmlLibraryCodec.class);

    static final String DOCUMENT_VERSION = "19";

    static final int CUE_HOT = 0;
    static final int CUE_LOOP = 1;
    static final int CUE_GRID = 4;
    static final int CUE_BEAT = 9;

    private final XmlMapper mapper = XmlMappers.create();
    private final AppMigrationProperties migrationProperties;

    public NmlLibraryCodec(AppMigrationProperties migrationProperties) {
        this.migrationProperties = migrationProperties;
    }

    @Override
    public LibraryFormat format() {
        return LibraryFormat.NML;
    }

    // ════════════════════════════════════════════════════════
    // Read
    // ════════════════════════════════════════════════════════

    @Override
    public LibraryDocument read(Path source) throws IOException {
        NmlDocument document = XmlMappers.readDocument(mapper, source, NmlDocument.class, "NML");
        LibraryDocument result = new LibraryDocument();
        Map<String, Track> byId = new HashMap<>();

        List<NmlEntry> entries = document.getCollection() == null || document.getCollection().getEntries() == null
                ? new ArrayList<NmlEntry>() : document.getCollection().getEntries();
        int index = 0;
        for (NmlEntry entry : entries) {
            index++;
            String ref = FieldValues.isBlank(entry.getId()) ? "ENTRY#" + index : entry.getId().trim();
            String missing = missingRequiredField(entry);
            if (missing != null) {
                skip(result, ref, SkipReason.MISSING_REQUIRED_FIELD, "missing " + missing);
                continue;
            }
            if (byId.containsKey(ref)) {
                skip(result, ref, SkipReason.DUPLICATE_IDENTITY, "ID already used by an earlier entry");
                continue;
            }
            Track track = toTrack(ref, entry, result);
            byId.put(ref, track);
            result.getTracks().add(track);
        }

        if (document.getSets() != null && document.getSets().getNodes() != null) {
            for (NmlNode node : document.getSets().getNodes()) {
                collectPlaylists(node, new ArrayList<String>(), byId, result);
            }
        }
        log.info("NML_READ source={} tracks={} playlists={} skipped={}",
                source, result.getTracks().size(), result.getPlaylists().size(), result.getSkipped().size());
        return result;
    }

    private String missingRequiredField(NmlEntry entry) {
        if (FieldValues.isBlank(entry.getId())) {
            return "ID";
        }
        if (entry.getTitle() == null) {
            return "TITLE";
        }
        if (entry.getArtist() == null) {
            return "ARTIST";
        }
        if (entry.getLocation() == null || FieldValues.isBlank(entry.getLocation().getFile())) {
            return "LOCATION/@FILE";
        }
        return null;
    }

    private Track toTrack(String id, NmlEntry entry, LibraryDocument result) {
        Track track = new Track();
        track.setSourceId(id);
        track.setFilePath(NmlPaths.toFilePath(entry.getLocation()));
        track.setTitle(FieldValues.trimToEmpty(entry.getTitle()));
        track.setArtist(FieldValues.trimToEmpty(entry.getArtist()));
        if (entry.getAlbum() != null) {
            track.setAlbum(FieldValues.trimToEmpty(entry.getAlbum().getTitle()));
        }
        if (entry.getTempo() != null) {
            Double bpm = FieldValues.parseDouble(entry.getTempo().getBpm());
            if (bpm != null && bpm > 0) {
                track.setBpm(bpm);
            }
        }
        if (entry.getMusicalKey() != null) {
            track.setKey(KeyNames.normalize(entry.getMusicalKey().getValue()));
        }
        NmlEntry.Info info = entry.getInfo();
        if (info != null) {
            track.setGenre(FieldValues.trimToEmpty(info.getGenre()));
            track.setComment(FieldValues.trimToEmpty(info.getComment()));
            track.setYear(FieldValues.trimToEmpty(info.getReleaseDate()));
            Double playtime = FieldValues.parseDouble(info.getPlaytime());
            if (playtime != null && playtime > 0) {
                track.setDuration(playtime);
            }
            Integer energy = FieldValues.parseInt(info.getEnergy());
            if (energy != null) {
                track.setEnergy(energy);
            }
        }
        if (entry.getCues() != null) {
            for (NmlEntry.Cue cue : entry.getCues()) {
                CueMarker marker = toMarker(cue);
                if (marker == null) {
                    skip(result, id, SkipReason.UNSUPPORTED_CUE_TYPE, "CUE_V2 TYPE=" + cue.getType());
                } else {
                    track.getCuePoints().add(marker);
                }
            }
        }
        track.applyDefaults();
        return track;
    }

    private CueMarker toMarker(NmlEntry.Cue cue) {
        Integer code = FieldValues.parseInt(cue.getType());
        Double startMs = FieldValues.parseDouble(cue.getStart());
        if (code == null || startMs == null) {
            return null;
        }
        CueType type;
        switch (code) {
            case CUE_HOT:
                type = CueType.HOT_CUE;
                break;
            case CUE_LOOP:
                type = CueType.LOOP;
                break;
            case CUE_GRID:
                type = CueType.GRID;
                break;
            case CUE_BEAT:
                type = CueType.BEAT;
                break;
            default:
                return null;
        }
        Double lengthMs = FieldValues.parseDouble(cue.getLength());
        Integer slot = FieldValues.parseInt(cue.getHotCue());
        return new CueMarker(type, startMs / 1000D, FieldValues.trimToEmpty(cue.getName()),
                slot == null || slot < 0 ? CueMarker.NO_SLOT : slot,
                lengthMs == null || lengthMs < 0 ? 0D : lengthMs / 1000D);
    }

    private void collectPlaylists(NmlNode node, List<String> folderPath, Map<String, Track> byId,
                                  LibraryDocument result) {
        String type = FieldValues.trimToEmpty(node.getType());
        String name = FieldValues.trimToEmpty(node.getName());
        if (NmlNode.TYPE_FOLDER.equalsIgnoreCase(type)) {
            List<String> nested = new ArrayList<>(folderPath);
            nested.add(name);
            for (NmlNode child : children(node)) {
                collectPlaylists(child, nested, byId, result);
            }
        } else if (NmlNode.TYPE_PLAYLIST.equalsIgnoreCase(type)) {
            Playlist playlist = new Playlist(name, folderPath);
            for (NmlNode child : children(node)) {
                if (!NmlNode.TYPE_TRACK.equalsIgnoreCase(FieldValues.trimToEmpty(child.getType()))) {
                    continue;
                }
                Track track = byId.get(FieldValues.trimToEmpty(child.getKey()));
                if (track == null) {
                    skip(result, name, SkipReason.UNRESOLVED_REFERENCE, "KEY=" + child.getKey());
                } else {
                    playlist.getTracks().add(track);
                }
            }
            result.getPlaylists().add(playlist);
        } else {
            log.debug("NML_NODE_IGNORED type={} name={}", type, name);
        }
    }

    private static List<NmlNode> children(NmlNode node) {
        return node.getChildren() == null ? new ArrayList<NmlNode>() : node.getChildren();
    }

    private static void skip(LibraryDocument result, String ref, SkipReason reason, String detail) {
        result.skip(ref, reason, detail);
        log.debug("CODEC_ENTRY_SKIPPED format=NML entry={} reason={} detail={}", ref, reason, detail);
    }

    // ════════════════════════════════════════════════════════
    // Write
    // ════════════════════════════════════════════════════════

    @Override
    public IdentityAssignment write(Path target, List<Track> tracks, List<Playlist> playlists) throws IOException {
        IdentityAssignment assignment = new IdentityAssignment();
        NmlDocument document = new NmlDocument();
        document.setVersion(DOCUMENT_VERSION);

        NmlDocument.Head head = new NmlDocument.Head();
        head.setCompany(migrationProperties.getNmlCompany());
        head.setProgram(migrationProperties.getNmlProgram());
        document.setHead(head);

        NmlDocument.Collection collection = new NmlDocument.Collection();
        int droppedCues = 0;
        for (Track track : tracks) {
            if (assignment.contains(track)) {
                continue;
            }
            String id = UUID.randomUUID().toString();
            assignment.assign(track, id);
            NmlEntry entry = toEntry(id, track);
            droppedCues += track.getCuePoints().size() - entry.getCues().size();
            collection.getEntries().add(entry);
        }
        collection.setEntryCount(String.valueOf(collection.getEntries().size()));
        document.setCollection(collection);

        NmlDocument.Sets sets = new NmlDocument.Sets();
        Map<String, NmlNode> folders = new LinkedHashMap<>();
        for (Playlist playlist : playlists) {
            NmlNode playlistNode = new NmlNode(NmlNode.TYPE_PLAYLIST, playlist.getName());
            for (Track track : playlist.getTracks()) {
                String id = assignment.idOf(track);
                if (id == null) {
                    assignment.recordDroppedPlaylistReference();
                    continue;
                }
                playlistNode.getChildren().add(NmlNode.trackRef(id));
            }
            parentFor(playlist.getFolderPath(), sets, folders).add(playlistNode);
        }
        document.setSets(sets);

        DocumentFiles.writeAtomically(target, out -> mapper.writeValue(out, document));
        log.info("NML_WRITTEN target={} tracks={} playlists={} droppedCues={} droppedPlaylistRefs={}",
                target, assignment.size(), playlists.size(), droppedCues,
                assignment.getDroppedPlaylistReferences());
        return assignment;
    }

    private List<NmlNode> parentFor(List<String> folderPath, NmlDocument.Sets sets, Map<String, NmlNode> folders) {
        List<NmlNode> level = sets.getNodes();
        StringBuilder pathKey = new StringBuilder();
        for (String folderName : folderPath) {
            pathKey.append('/').append(folderName);
            NmlNode folder = folders.get(pathKey.toString());
            if (folder == null) {
                folder = new NmlNode(NmlNode.TYPE_FOLDER, folderName);
                folders.put(pathKey.toString(), folder);
                level.add(folder);
            }
            level = folder.getChildren();
        }
        return level;
    }

    private NmlEntry toEntry(String id, Track track) {
        NmlEntry entry = new NmlEntry();
        entry.setId(id);
        entry.setTitle(track.getTitle());
        entry.setArtist(track.getArtist());

        NmlEntry.Album album = new NmlEntry.Album();
        album.setTitle(track.getAlbum());
        entry.setAlbum(album);

        if (track.getBpm() > 0) {
            NmlEntry.Tempo tempo = new NmlEntry.Tempo();
            tempo.setBpm(FieldValues.formatDecimal(track.getBpm(), 6));
            tempo.setBpmQuality("100.000000");
            entry.setTempo(tempo);
        }
        if (KeyNames.isKnown(track.getKey())) {
            NmlEntry.MusicalKey key = new NmlEntry.MusicalKey();
            key.setValue(track.getKey());
            entry.setMusicalKey(key);
        }
        entry.setLocation(NmlPaths.toLocation(track.getFilePath()));

        NmlEntry.Info info = new NmlEntry.Info();
        info.setGenre(track.getGenre());
        info.setPlaytime(String.valueOf(Math.round(track.getDuration())));
        info.setComment(track.getComment());
        info.setReleaseDate(track.getYear());
        info.setEnergy(String.valueOf(track.getEnergy()));
        entry.setInfo(info);

        int nextSlot = 0;
        for (CueMarker marker : track.getCuePoints()) {
            NmlEntry.Cue cue = toCue(marker, nextSlot);
            if (cue == null) {
                continue;
            }
            if (marker.getType() == CueType.HOT_CUE) {
                nextSlot = Math.max(nextSlot, FieldValues.parseInt(cue.getHotCue()) + 1);
            }
            entry.getCues().add(cue);
        }
        return entry;
    }

    private NmlEntry.Cue toCue(CueMarker marker, int nextSlot) {
        int code;
        switch (marker.getType()) {
            case HOT_CUE:
                code = CUE_HOT;
                break;
            case LOOP:
                code = CUE_LOOP;
                break;
            case GRID:
                code = CUE_GRID;
                break;
            case BEAT:
                code = CUE_BEAT;
                break;
            default:
                return null;
        }
        NmlEntry.Cue cue = new NmlEntry.Cue();
        cue.setName(marker.getLabel() == null ? "" : marker.getLabel());
        cue.setType(String.valueOf(code));
        cue.setStart(FieldValues.formatDecimal(marker.getStartSeconds() * 1000D, 3));
        cue.setLength(FieldValues.formatDecimal(Math.max(0D, marker.getLengthSeconds()) * 1000D, 3));
        int slot = -1;
        if (marker.getType() == CueType.HOT_CUE) {
            slot = marker.getHotCueSlot() >= 0 ? marker.getHotCueSlot() : nextSlot;
        }
        cue.setHotCue(String.valueOf(slot));
        return cue;
    }
}
