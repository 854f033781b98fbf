package com.example.cratebridge.infrastructure.format;

import com.example.cratebridge.domain.enumtype.LibraryFormat;
import com.example.cratebridge.infrastructure.format.csv.CsvLibraryCodec;
import com.example.cratebridge.infrastructure.format.m3u.M3uPlaylistCodec;
import com.example.cratebridge.infrastructure.format.nml.NmlLibraryCodec;
import com.example.cratebridge.infrastructure.format.rekordbox.RekordboxXmlLibraryCodec;
import org.springframework.stereotype.Component;

@Component
public class LibraryCodecs {

    private final NmlLibraryCodec nmlCodec;
    private final RekordboxXmlLibraryCodec rekordboxCodec;
    private final CsvLibraryCodec csvCodec;
    private final M3uPlaylistCodec m3uCodec;

    public LibraryCodecs(NmlLibraryCodec nmlCodec,
                         RekordboxXmlLibraryCodec rekordboxCodec,
                         CsvLibraryCodec csvCodec,
                         M3uPlaylistCodec m3uCodec) {
        this.nmlCodec = nmlCodec;
        this.rekordboxCodec = rekordboxCodec;
        this.csvCodec = csvCodec;
        this.m3uCodec = m3uCodec;
    }

    public LibraryCodec codecFor(LibraryFormat format) {
        switch (format) {
            case NML:
                return nmlCodec;
            case REKORDBOX_XML:
                return rekordboxCodec;
            case CSV:
                return csvCodec;
            case M3U:
                return m3uCodec;
            default:
                throw new IllegalArgumentException("Unhandled library format: " + format);
        }
    }
}
