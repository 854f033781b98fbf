package com.example.cratebridge.infrastructure.analysis;

/**
 * An estimate could not be produced. Callers downgrade the affected field to its "unknown" value.
 */
public class AnalysisException extends Exception {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
