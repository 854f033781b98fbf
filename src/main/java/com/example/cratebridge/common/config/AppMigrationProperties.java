package com.example.cratebridge.common.config;

import com.example.cratebridge.domain.enumtype.CueRetention;
import com.example.cratebridge.domain.enumtype.MissingFileHandling;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.migration")
public class AppMigrationProperties {

    private CueRetention cueRetention = CueRetention.KEEP_ALL;

    private MissingFileHandling missingFileHandling = MissingFileHandling.SKIP;

    private MissingFileHandling notLocatedFallback = MissingFileHandling.SKIP;

    private boolean mapFirstHotCueToMemory = false;

    private boolean mapMemoryToHotCue = false;

    private String nmlCompany = "www.native-instruments.com";

    private String nmlProgram = "Traktor";

    private String rekordboxProductName = "rekordbox";

    private String rekordboxProductVersion = "6.6.3";

    private String rekordboxCompany = "AlphaTheta";
}
