package com.example.cratebridge.domain.model;

import lombok.Data;

/**
 * Raw values read from an audio file's embedded tags. Absent fields stay {@code null}.
 */
@Data
public class TagData {

    private String title;

    private String artist;

    private String album;

    private String genre;

    private String year;

    private String comment;

    private Double bpm;

    private String key;

    private Double durationSec;
}
