package com.example.cratebridge.application.service;

import com.example.cratebridge.common.util.KeyNames;
import com.example.cratebridge.domain.model.TagData;
import com.example.cratebridge.domain.model.Track;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Copies tag values onto a track and fills whatever the tags did not provide with placeholders.
 */
@Service
public class MetadataFallbackService {

    public Track applyTags(Track track, TagData tags) {
        if (tags != null) {
            track.setTitle(trimToNull(tags.getTitle()));
            track.setArtist(trimToNull(tags.getArtist()));
            track.setAlbum(trimToNull(tags.getAlbum()));
            track.setGenre(trimToNull(tags.getGenre()));
            track.setYear(trimToNull(tags.getYear()));
            track.setComment(trimToNull(tags.getComment()));
            if (tags.getBpm() != null && tags.getBpm() > 0) {
                track.setBpm(tags.getBpm());
            }
            String key = KeyNames.normalize(tags.getKey());
            if (key != null) {
                track.setKey(key);
            }
            if (tags.getDurationSec() != null && tags.getDurationSec() > 0) {
                track.setDuration(tags.getDurationSec());
            }
        }
        track.applyDefaults();
        return track;
    }

    private String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
