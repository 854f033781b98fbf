package com.example.cratebridge.application.service;

/**
 * Progress callback for long-running jobs. {@code current} and {@code total} are {@code null} at phase boundaries.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (percent, message, current, total) -> {
    };

    void onProgress(int percent, String message, Integer current, Integer total);
}
