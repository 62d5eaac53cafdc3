package com.di.statsrollup.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Disk I/O section of a sample. Only {@code io_service_bytes} is read; {@code io_serviced}
 * and the other blkio breakdowns are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DiskIoStats(
    @JsonProperty("io_service_bytes") List<PerDiskStats> ioServiceBytes
) {

    /**
     * Per-device entry. {@code stats} maps a category name (Async, Sync, Read, Write, Total)
     * to its byte count.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PerDiskStats(
        long major,
        long minor,
        Map<String, Long> stats
    ) {}
}
