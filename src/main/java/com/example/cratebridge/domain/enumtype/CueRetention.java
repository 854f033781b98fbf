package com.example.cratebridge.domain.enumtype;

public enum CueRetention {

    KEEP_ALL(Integer.MAX_VALUE),

    KEEP_FIRST_8(8),

    DROP_ALL(0);

    private final int limit;

    CueRetention(int limit) {
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
