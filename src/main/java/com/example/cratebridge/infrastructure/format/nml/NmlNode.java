package com.example.cratebridge.infrastructure.format.nml;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Node of the playlist tree: {@code FOLDER} nodes nest, {@code PLAYLIST} nodes hold {@code TRACK} nodes whose
 * {@code KEY} is a collection entry id.
 */
@Data
@NoArgsConstructor
public class NmlNode {

    public static final String TYPE_FOLDER = "FOLDER";
    public static final String TYPE_PLAYLIST = "PLAYLIST";
    public static final String TYPE_TRACK = "TRACK";

    @JacksonXmlProperty(isAttribute = true, localName = "TYPE")
    private String type;

    @JacksonXmlProperty(isAttribute = true, localName = "NAME")
    private String name;

    @JacksonXmlProperty(isAttribute = true, localName = "KEY")
    private String key;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "NODE")
    private List<NmlNode> children = new ArrayList<>();

    public NmlNode(String type, String name) {
        this.type = type;
        this.name = name;
    }

    public static NmlNode trackRef(String entryId) {
        NmlNode node = new NmlNode(TYPE_TRACK, null);
        node.setKey(entryId);
        node.setChildren(null);
        return node;
    }
}
