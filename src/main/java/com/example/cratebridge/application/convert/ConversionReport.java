package com.example.cratebridge.application.convert;

import com.example.cratebridge.domain.model.EntrySkip;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class ConversionReport {

    private ConversionDirection direction;

    private int trackCount;

    private int playlistCount;

    private int droppedPlaylistReferences;

    private IdentityRemapTable identityTable;

    private List<EntrySkip> skipped = new ArrayList<>();
}
