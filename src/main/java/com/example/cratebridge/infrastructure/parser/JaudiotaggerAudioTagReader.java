package com.example.cratebridge.infrastructure.parser;

import com.example.cratebridge.domain.enumtype.AudioContainer;
import com.example.cratebridge.domain.model.TagData;
import java.io.File;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.AudioHeader;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.KeyNotFoundException;
import org.jaudiotagger.tag.Tag;
import org.springframework.stereotype.Component;

@Component
public class JaudiotaggerAudioTagReader implements AudioTagReader {

    private static final Pattern FIRST_DECIMAL_PATTERN = Pattern.compile("(\\d+(?:[.,]\\d+)?)");

    @Override
    public TagData read(File audioFile, AudioContainer container) throws Exception {
        AudioFile parsed = AudioFileIO.readAs(audioFile, container.getReaderExtension());
        Tag tag = parsed.getTag();
        AudioHeader header = parsed.getAudioHeader();
        if (header == null) {
            throw new IllegalStateException("no audio header found");
        }

        TagData data = new TagData();
        data.setTitle(safeTagValue(tag, FieldKey.TITLE));
        data.setArtist(safeTagValue(tag, FieldKey.ARTIST));
        data.setAlbum(safeTagValue(tag, FieldKey.ALBUM));
        data.setGenre(safeTagValue(tag, FieldKey.GENRE));
        data.setYear(safeTagValue(tag, FieldKey.YEAR));
        data.setComment(safeTagValue(tag, FieldKey.COMMENT));
        data.setBpm(parseDecimal(safeTagValue(tag, FieldKey.BPM)));
        data.setKey(safeTagValue(tag, FieldKey.KEY));
        data.setDurationSec(header.getPreciseTrackLength());
        return data;
    }

    private String safeTagValue(Tag tag, FieldKey fieldKey) {
        if (tag == null) {
            return null;
        }
        String value;
        try {
            value = tag.getFirst(fieldKey);
        } catch (KeyNotFoundException | UnsupportedOperationException e) {
            // field not representable in this tag flavour
            return null;
        }
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private Double parseDecimal(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        Matcher matcher = FIRST_DECIMAL_PATTERN.matcher(raw);
        if (!matcher.find()) {
            return null;
        }
        try {
            double value = Double.parseDouble(matcher.group(1).replace(',', '.'));
            return value > 0 ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
