package com.example.cratebridge.infrastructure.format.rekordbox;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Playlist tree node: Type 0 is a folder, Type 1 a playlist whose TRACK children reference collection TrackIDs.
 */
@Data
@NoArgsConstructor
public class RekordboxNode {

    public static final String TYPE_FOLDER = "0";
    public static final String TYPE_PLAYLIST = "1";

    @JacksonXmlProperty(isAttribute = true, localName = "Type")
    private String type;

    @JacksonXmlProperty(isAttribute = true, localName = "Name")
    private String name;

    @JacksonXmlProperty(isAttribute = true, localName = "Count")
    private String count;

    @JacksonXmlProperty(isAttribute = true, localName = "KeyType")
    private String keyType;

    @JacksonXmlProperty(isAttribute = true, localName = "Entries")
    private String entryCount;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "NODE")
    private List<RekordboxNode> children;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "TRACK")
    private List<TrackRef> tracks;

    public static RekordboxNode folder(String name) {
        RekordboxNode node = new RekordboxNode();
        node.setType(TYPE_FOLDER);
        node.setName(name);
        node.setChildren(new ArrayList<RekordboxNode>());
        return node;
    }

    public static RekordboxNode playlist(String name) {
        RekordboxNode node = new RekordboxNode();
        node.setType(TYPE_PLAYLIST);
        node.setName(name);
        node.setKeyType("0");
        node.setTracks(new ArrayList<TrackRef>());
        return node;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TrackRef {

        @JacksonXmlProperty(isAttribute = true, localName = "Key")
        private String key;
    }
}
