package com.di.statsrollup.exception;

import com.di.statsrollup.rollup.DiskIoCategory;

/** Thrown when a per-device disk I/O entry has no byte count for the requested category. */
public class MissingCategoryException extends RollupException {

    private final DiskIoCategory category;

    public MissingCategoryException(DiskIoCategory category, long major, long minor) {
        super("Disk I/O entry " + major + ":" + minor + " has no '" + category.getKey() + "' byte count");
        this.category = category;
    }

    public DiskIoCategory getCategory() {
        return category;
    }
}
