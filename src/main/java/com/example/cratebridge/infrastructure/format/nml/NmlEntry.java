package com.example.cratebridge.infrastructure.format.nml;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
@JsonPropertyOrder({"id", "title", "artist", "album", "tempo", "musicalKey", "location", "info", "cues"})
public class NmlEntry {

    @JacksonXmlProperty(isAttribute = true, localName = "ID")
    private String id;

    @JacksonXmlProperty(localName = "TITLE")
    private String title;

    @JacksonXmlProperty(localName = "ARTIST")
    private String artist;

    @JacksonXmlProperty(localName = "ALBUM")
    private Album album;

    @JacksonXmlProperty(localName = "TEMPO")
    private Tempo tempo;

    @JacksonXmlProperty(localName = "KEY")
    private MusicalKey musicalKey;

    @JacksonXmlProperty(localName = "LOCATION")
    private Location location;

    @JacksonXmlProperty(localName = "INFO")
    private Info info;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "CUE_V2")
    private List<Cue> cues = new ArrayList<>();

    @Data
    public static class Album {

        @JacksonXmlProperty(isAttribute = true, localName = "TITLE")
        private String title;
    }

    @Data
    public static class Tempo {

        @JacksonXmlProperty(isAttribute = true, localName = "BPM")
        private String bpm;

        @JacksonXmlProperty(isAttribute = true, localName = "BPM_QUALITY")
        private String bpmQuality;
    }

    @Data
    public static class MusicalKey {

        @JacksonXmlProperty(isAttribute = true, localName = "VALUE")
        private String value;
    }

    @Data
    public static class Location {

        @JacksonXmlProperty(isAttribute = true, localName = "FILE")
        private String file;

        @JacksonXmlProperty(isAttribute = true, localName = "DIR")
        private String dir;

        @JacksonXmlProperty(isAttribute = true, localName = "VOLUME")
        private String volume;
    }

    @Data
    public static class Info {

        @JacksonXmlProperty(isAttribute = true, localName = "GENRE")
        private String genre;

        @JacksonXmlProperty(isAttribute = true, localName = "PLAYTIME")
        private String playtime;

        @JacksonXmlProperty(isAttribute = true, localName = "COMMENT")
        private String comment;

        @JacksonXmlProperty(isAttribute = true, localName = "RELEASE_DATE")
        private String releaseDate;

        @JacksonXmlProperty(isAttribute = true, localName = "ENERGY")
        private String energy;
    }

    /**
     * START and LEN are milliseconds.
     */
    @Data
    public static class Cue {

        @JacksonXmlProperty(isAttribute = true, localName = "NAME")
        private String name;

        @JacksonXmlProperty(isAttribute = true, localName = "TYPE")
        private String type;

        @JacksonXmlProperty(isAttribute = true, localName = "START")
        private String start;

        @JacksonXmlProperty(isAttribute = true, localName = "LEN")
        private String length;

        @JacksonXmlProperty(isAttribute = true, localName = "HOTCUE")
        private String hotCue;
    }
}
