package com.example.cratebridge.infrastructure.format.csv;

import com.example.cratebridge.common.exception.LibraryException;
import com.example.cratebridge.common.util.KeyNames;
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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Flat UTF-8 CSV track lists with a header row. Carries no playlists and no cue points.
 */
@Component
public class CsvLibraryCodec implements LibraryCodec {

    private static final Logger log = LoggerFactory.getLogger(CsvLibraryCodec.class);

    private static final List<String> PATH_COLUMNS = Arrays.asList("path", "location");
    private static final List<String> TITLE_COLUMNS = Arrays.asList("name", "title");

    private final CsvMapper mapper;

    public CsvLibraryCodec() {
        this.mapper = new CsvMapper();
        mapper.enable(CsvParser.Feature.TRIM_SPACES);
        mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        mapper.enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE);
    }

    @Override
    public LibraryFormat format() {
        return LibraryFormat.CSV;
    }

    @Override
    public LibraryDocument read(Path source) throws IOException {
        DocumentFiles.requireReadable(source, "CSV document");
        String content = new String(Files.readAllBytes(source), StandardCharsets.UTF_8);
        if (content.startsWith("\uFEFF")) {
            content = content.substring(1);
        }
        LibraryDocument result = new LibraryDocument();
        if (content.trim().isEmpty()) {
            return result;
        }

        List<Map<String, String>> rows = new ArrayList<>();
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> iterator =
                     mapper.readerFor(Map.class).with(schema).readValues(content)) {
            while (iterator.hasNextValue()) {
                rows.add(lowerCaseKeys(iterator.nextValue()));
            }
        } catch (JsonProcessingException e) {
            throw new LibraryException(LibraryException.DOCUMENT_MALFORMED,
                    "CSV document could not be parsed: " + e.getOriginalMessage(),
                    "Check that the file is comma separated with a header row", e);
        }

        int rowNumber = 1;
        for (Map<String, String> row : rows) {
            rowNumber++;
            String ref = "row " + rowNumber;
            if (!hasAny(row, PATH_COLUMNS)) {
                result.skip(ref, SkipReason.MISSING_PATH_COLUMN, "no path or location column");
                continue;
            }
            String path = first(row, PATH_COLUMNS);
            if (FieldValues.isBlank(path)) {
                result.skip(ref, SkipReason.MISSING_REQUIRED_FIELD, "blank path");
                log.debug("CODEC_ENTRY_SKIPPED format=CSV entry={} reason={}", ref,
                        SkipReason.MISSING_REQUIRED_FIELD);
                continue;
            }
            result.getTracks().add(toTrack(path, row));
        }
        log.info("CSV_READ source={} rows={} tracks={} skipped={}",
                source, rows.size(), result.getTracks().size(), result.getSkipped().size());
        return result;
    }

    private Track toTrack(String path, Map<String, String> row) {
        Track track = new Track();
        track.setFilePath(LocationUris.toFilePath(path.trim()));
        track.setTitle(FieldValues.trimToEmpty(first(row, TITLE_COLUMNS)));
        track.setArtist(FieldValues.trimToEmpty(row.get("artist")));
        track.setAlbum(FieldValues.trimToEmpty(row.get("album")));
        track.setGenre(FieldValues.trimToEmpty(row.get("genre")));
        Double bpm = FieldValues.parseDouble(row.get("bpm"));
        if (bpm != null && bpm > 0) {
            track.setBpm(bpm);
        }
        track.setKey(KeyNames.normalize(row.get("key")));
        track.applyDefaults();
        return track;
    }

    private static Map<String, String> lowerCaseKeys(Map<String, String> row) {
        Map<String, String> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, String> column : row.entrySet()) {
            if (column.getKey() != null) {
                normalized.putIfAbsent(column.getKey().trim().toLowerCase(Locale.ROOT), column.getValue());
            }
        }
        return normalized;
    }

    private static boolean hasAny(Map<String, String> row, List<String> aliases) {
        for (String alias : aliases) {
            if (row.containsKey(alias)) {
                return true;
            }
        }
        return false;
    }

    private static String first(Map<String, String> row, List<String> aliases) {
        for (String alias : aliases) {
            String value = row.get(alias);
            if (!FieldValues.isBlank(value)) {
                return value;
            }
        }
        return null;
    }

    @Override
    public IdentityAssignment write(Path target, List<Track> tracks, List<Playlist> playlists) throws IOException {
        IdentityAssignment assignment = new IdentityAssignment();
        List<CsvTrackRow> rows = new ArrayList<>();
        for (Track track : tracks) {
            if (assignment.contains(track)) {
                continue;
            }
            assignment.assign(track, track.getFilePath());
            rows.add(new CsvTrackRow(track.getTitle(), track.getArtist(), track.getAlbum(), track.getGenre(),
                    FieldValues.formatDecimal(track.getBpm(), 2), track.getKey(), track.getFilePath()));
        }
        CsvSchema schema = mapper.schemaFor(CsvTrackRow.class).withHeader();
        DocumentFiles.writeAtomically(target, out -> {
            Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            mapper.writer(schema).writeValue(writer, rows);
        });
        if (!playlists.isEmpty()) {
            log.debug("CSV_PLAYLISTS_IGNORED target={} playlists={}", target, playlists.size());
        }
        log.info("CSV_WRITTEN target={} tracks={}", target, rows.size());
        return assignment;
    }
}
