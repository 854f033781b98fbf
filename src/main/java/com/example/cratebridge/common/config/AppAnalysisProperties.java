package com.example.cratebridge.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Bounded excerpt windows for signal analysis. Every estimate decodes at most {@code offset + duration} seconds.
 */
@Data
@ConfigurationProperties(prefix = "app.analysis")
public class AppAnalysisProperties {

    private int sampleRate = 22050;

    private double tempoOffsetSec = 30D;

    private double tempoDurationSec = 30D;

    private double keyOffsetSec = 30D;

    private double keyDurationSec = 20D;

    private double energyOffsetSec = 30D;

    private double energyDurationSec = 15D;

    private double minBpm = 60D;

    private double maxBpm = 200D;
}
