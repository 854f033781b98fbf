package com.example.cratebridge.domain.enumtype;

public enum MigrationPhase {

    PENDING(0, 0),

    READING(0, 30),

    PROCESSING(30, 70),

    WRITING(70, 100),

    DONE(100, 100),

    CANCELED(-1, -1);

    private final int startPercent;
    private final int endPercent;

    MigrationPhase(int startPercent, int endPercent) {
        this.startPercent = startPercent;
        this.endPercent = endPercent;
    }

    public int getStartPercent() {
        return startPercent;
    }

    public int getEndPercent() {
        return endPercent;
    }

    public boolean isTerminal() {
        return this == DONE || this == CANCELED;
    }

    /**
     * Maps progress inside this phase onto the job-wide percentage.
     */
    public int percentAt(int current, int total) {
        if (total <= 0 || startPercent < 0) {
            return Math.max(startPercent, 0);
        }
        int bounded = Math.max(0, Math.min(current, total));
        return startPercent + (int) ((long) (endPercent - startPercent) * bounded / total);
    }
}
