package com.example.cratebridge.infrastructure.analysis;

import com.example.cratebridge.common.config.AppAnalysisProperties;
import java.io.File;
import org.springframework.stereotype.Component;

@Component
public class DefaultSignalAnalyzer implements SignalAnalyzer {

    private final PcmExcerptLoader excerptLoader;
    private final AppAnalysisProperties properties;
    private final TempoEstimator tempoEstimator;
    private final KeyEstimator keyEstimator = new KeyEstimator();
    private final EnergyEstimator energyEstimator = new EnergyEstimator();

    public DefaultSignalAnalyzer(PcmExcerptLoader excerptLoader, AppAnalysisProperties properties) {
        this.excerptLoader = excerptLoader;
        this.properties = properties;
        this.tempoEstimator = new TempoEstimator(properties.getMinBpm(), properties.getMaxBpm());
    }

    @Override
    public double estimateTempo(File audioFile) throws AnalysisException {
        float[] samples = excerptLoader.load(audioFile, properties.getTempoOffsetSec(),
                properties.getTempoDurationSec(), properties.getSampleRate());
        return tempoEstimator.estimate(samples, properties.getSampleRate());
    }

    @Override
    public String estimateKey(File audioFile) throws AnalysisException {
        float[] samples = excerptLoader.load(audioFile, properties.getKeyOffsetSec(),
                properties.getKeyDurationSec(), properties.getSampleRate());
        return keyEstimator.estimate(samples, properties.getSampleRate());
    }

    @Override
    public int estimateEnergy(File audioFile) throws AnalysisException {
        float[] samples = excerptLoader.load(audioFile, properties.getEnergyOffsetSec(),
                properties.getEnergyDurationSec(), properties.getSampleRate());
        return energyEstimator.estimate(samples);
    }
}
