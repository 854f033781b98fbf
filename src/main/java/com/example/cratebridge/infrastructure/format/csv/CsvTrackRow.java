package com.example.cratebridge.infrastructure.format.csv;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fixed column layout used when writing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"name", "artist", "album", "genre", "bpm", "key", "path"})
public class CsvTrackRow {

    private String name;

    private String artist;

    private String album;

    private String genre;

    private String bpm;

    private String key;

    private String path;
}
