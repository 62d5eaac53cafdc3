package com.di.statsrollup.rollup;

/** Byte-count categories of a cAdvisor {@code io_service_bytes} entry that the rollup reports. */
public enum DiskIoCategory {

    ASYNC("Async"),
    SYNC("Sync"),
    READ("Read"),
    WRITE("Write");

    private final String key;

    DiskIoCategory(String key) {
        this.key = key;
    }

    /** Key of this category inside a per-device {@code stats} map. */
    public String getKey() {
        return key;
    }
}
