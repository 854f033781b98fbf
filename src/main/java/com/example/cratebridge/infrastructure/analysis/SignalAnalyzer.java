package com.example.cratebridge.infrastructure.analysis;

import java.io.File;

/**
 * Estimates analytic fields from bounded excerpts of the decoded signal.
 */
public interface SignalAnalyzer {

    double estimateTempo(File audioFile) throws AnalysisException;

    String estimateKey(File audioFile) throws AnalysisException;

    int estimateEnergy(File audioFile) throws AnalysisException;
}
