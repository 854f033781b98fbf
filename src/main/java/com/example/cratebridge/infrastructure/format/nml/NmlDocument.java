package com.example.cratebridge.infrastructure.format.nml;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Jackson binding of a Traktor collection document. Numeric attributes are kept as text; a bad value skips only
 * its own entry.
 */
@Data
@JacksonXmlRootElement(localName = "NML")
@JsonPropertyOrder({"version", "head", "collection", "sets"})
public class NmlDocument {

    @JacksonXmlProperty(isAttribute = true, localName = "VERSION")
    private String version;

    @JacksonXmlProperty(localName = "HEAD")
    private Head head;

    @JacksonXmlProperty(localName = "COLLECTION")
    private Collection collection;

    @JacksonXmlProperty(localName = "SETS")
    private Sets sets;

    @Data
    public static class Head {

        @JacksonXmlProperty(isAttribute = true, localName = "COMPANY")
        private String company;

        @JacksonXmlProperty(isAttribute = true, localName = "PROGRAM")
        private String program;
    }

    @Data
    public static class Collection {

        @JacksonXmlProperty(isAttribute = true, localName = "ENTRIES")
        private String entryCount;

        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "ENTRY")
        private List<NmlEntry> entries = new ArrayList<>();
    }

    @Data
    public static class Sets {

        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "NODE")
        private List<NmlNode> nodes = new ArrayList<>();
    }
}
