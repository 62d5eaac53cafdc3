package com.di.statsrollup.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Single per-second sample for one container, as reported by cAdvisor.
 * The timestamp is kept as the raw RFC 3339 string; {@link ContainerWindow} parses it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContainerStats(
    String timestamp,
    CpuStats cpu,
    MemoryStats memory,
    NetworkStats network,
    DiskIoStats diskio
) {}
