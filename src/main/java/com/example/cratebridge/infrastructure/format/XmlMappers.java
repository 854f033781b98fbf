package com.example.cratebridge.infrastructure.format;

import com.example.cratebridge.common.exception.LibraryException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared Jackson XML setup for the XML-based library formats.
 */
public final class XmlMappers {

    private XmlMappers() {
    }

    public static XmlMapper create() {
        XmlMapper mapper = new XmlMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.enable(ToXmlGenerator.Feature.WRITE_XML_DECLARATION);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return mapper;
    }

    /**
     * Binds a whole document; a failure here means the document is unusable, not that one entry is bad.
     */
    public static <T> T readDocument(XmlMapper mapper, Path source, Class<T> type, String formatName)
            throws IOException {
        DocumentFiles.requireReadable(source, formatName + " document");
        try (InputStream in = Files.newInputStream(source)) {
            T document = mapper.readValue(in, type);
            if (document == null) {
                throw new LibraryException(LibraryException.DOCUMENT_MALFORMED,
                        formatName + " document is empty: " + source);
            }
            return document;
        } catch (JsonProcessingException e) {
            throw new LibraryException(LibraryException.DOCUMENT_MALFORMED,
                    formatName + " document could not be parsed: " + e.getOriginalMessage(),
                    "Check that the file is a valid " + formatName + " export", e);
        }
    }
}
