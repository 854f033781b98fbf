package com.example.cratebridge.common.util;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Cooperative cancellation flag owned by the caller of a single scan or migration job.
 */
public class CancellationToken implements BooleanSupplier {

    private final AtomicBoolean requested = new AtomicBoolean(false);

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        requested.set(true);
    }

    public boolean isCancellationRequested() {
        return requested.get();
    }

    @Override
    public boolean getAsBoolean() {
        return requested.get();
    }
}
