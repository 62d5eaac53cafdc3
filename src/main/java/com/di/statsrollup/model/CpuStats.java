package com.di.statsrollup.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * CPU section of a sample. {@code usage.total} is a cumulative counter in nanoseconds;
 * {@code load_average} is an instantaneous gauge.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CpuStats(
    Usage usage,
    @JsonProperty("load_average") long loadAverage
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Usage(long total) {}
}
