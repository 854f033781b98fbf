package com.example.cratebridge.infrastructure.format.rekordbox;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
@JacksonXmlRootElement(localName = "DJ_PLAYLISTS")
@JsonPropertyOrder({"version", "product", "collection", "playlists"})
public class RekordboxDocument {

    @JacksonXmlProperty(isAttribute = true, localName = "Version")
    private String version;

    @JacksonXmlProperty(localName = "PRODUCT")
    private Product product;

    @JacksonXmlProperty(localName = "COLLECTION")
    private Collection collection;

    @JacksonXmlProperty(localName = "PLAYLISTS")
    private Playlists playlists;

    @Data
    public static class Product {

        @JacksonXmlProperty(isAttribute = true, localName = "Name")
        private String name;

        @JacksonXmlProperty(isAttribute = true, localName = "Version")
        private String version;

        @JacksonXmlProperty(isAttribute = true, localName = "Company")
        private String company;
    }

    @Data
    public static class Collection {

        @JacksonXmlProperty(isAttribute = true, localName = "Entries")
        private String entryCount;

        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "TRACK")
        private List<RekordboxTrack> tracks = new ArrayList<>();
    }

    @Data
    public static class Playlists {

        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "NODE")
        private List<RekordboxNode> nodes = new ArrayList<>();
    }
}
