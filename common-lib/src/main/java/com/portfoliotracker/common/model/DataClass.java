package com.portfoliotracker.common.model;

/**
 * The two independently cached kinds of per-symbol market data.
 *
 * <p>Each class carries its freshness window in calendar days and the key used
 * when archiving raw provider responses.
 */
public enum DataClass {
    TIME_SERIES("ts", 1),
    OVERVIEW("overview", 7);

    private final String archiveKey;
    private final int ttlDays;

    DataClass(String archiveKey, int ttlDays) {
        this.archiveKey = archiveKey;
        this.ttlDays = ttlDays;
    }

    public String archiveKey() {
        return archiveKey;
    }

    public int ttlDays() {
        return ttlDays;
    }
}
