package com.example.cratebridge.infrastructure.parser;

import com.example.cratebridge.domain.enumtype.AudioContainer;
import com.example.cratebridge.domain.model.TagData;
import java.io.File;

public interface AudioTagReader {

    /**
     * Reads embedded tags and stream length.
     *
     * @throws Exception when the container header cannot be parsed
     */
    TagData read(File audioFile, AudioContainer container) throws Exception;
}
