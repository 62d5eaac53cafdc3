package com.di.statsrollup.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;

/**
 * Reduced output for one container window. {@code ts} is the epoch second of the window's first sample;
 * memory figures are in kilobytes.
 */
@Builder
@JsonPropertyOrder({"name", "ts", "cpu", "memory", "network", "diskio"})
public record ContainerSummary(
    String name,
    long ts,
    CpuSummary cpu,
    GaugeSummary memory,
    NetworkSummary network,
    DiskIoSummary diskio
) {}
