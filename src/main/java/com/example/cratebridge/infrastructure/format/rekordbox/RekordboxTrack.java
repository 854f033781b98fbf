package com.example.cratebridge.infrastructure.format.rekordbox;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Collection TRACK element.
 */
@Data
public class RekordboxTrack {

    @JacksonXmlProperty(isAttribute = true, localName = "TrackID")
    private String trackId;

    @JacksonXmlProperty(isAttribute = true, localName = "Name")
    private String name;

    @JacksonXmlProperty(isAttribute = true, localName = "Artist")
    private String artist;

    @JacksonXmlProperty(isAttribute = true, localName = "Album")
    private String album;

    @JacksonXmlProperty(isAttribute = true, localName = "Genre")
    private String genre;

    @JacksonXmlProperty(isAttribute = true, localName = "Kind")
    private String kind;

    @JacksonXmlProperty(isAttribute = true, localName = "Size")
    private String size;

    @JacksonXmlProperty(isAttribute = true, localName = "TotalTime")
    private String totalTime;

    @JacksonXmlProperty(isAttribute = true, localName = "Year")
    private String year;

    @JacksonXmlProperty(isAttribute = true, localName = "AverageBpm")
    private String averageBpm;

    @JacksonXmlProperty(isAttribute = true, localName = "Comments")
    private String comments;

    @JacksonXmlProperty(isAttribute = true, localName = "Rating")
    private String rating;

    @JacksonXmlProperty(isAttribute = true, localName = "Location")
    private String location;

    @JacksonXmlProperty(isAttribute = true, localName = "Tonality")
    private String tonality;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "TEMPO")
    private List<Tempo> tempos = new ArrayList<>();

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "POSITION_MARK")
    private List<PositionMark> positionMarks = new ArrayList<>();

    @Data
    public static class Tempo {

        @JacksonXmlProperty(isAttribute = true, localName = "Inizio")
        private String start;

        @JacksonXmlProperty(isAttribute = true, localName = "Bpm")
        private String bpm;

        @JacksonXmlProperty(isAttribute = true, localName = "Metro")
        private String meter;

        @JacksonXmlProperty(isAttribute = true, localName = "Battito")
        private String beat;
    }

    /**
     * Start and End are seconds.
     */
    @Data
    public static class PositionMark {

        @JacksonXmlProperty(isAttribute = true, localName = "Name")
        private String name;

        @JacksonXmlProperty(isAttribute = true, localName = "Type")
        private String type;

        @JacksonXmlProperty(isAttribute = true, localName = "Start")
        private String start;

        @JacksonXmlProperty(isAttribute = true, localName = "End")
        private String end;

        @JacksonXmlProperty(isAttribute = true, localName = "Num")
        private String num;

        @JacksonXmlProperty(isAttribute = true, localName = "Red")
        private String red;

        @JacksonXmlProperty(isAttribute = true, localName = "Green")
        private String green;

        @JacksonXmlProperty(isAttribute = true, localName = "Blue")
        private String blue;
    }
}
