package com.di.statsrollup.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Document sent to the collector once per run.
 *
 * @param timestamp epoch seconds at which the report was assembled (not the window start)
 * @param interval  window length in seconds
 * @param stats     one summary per rolled-up container, in production order
 * @param machine   host metadata from the source, passed through untouched (may be null)
 */
@JsonPropertyOrder({"timestamp", "interval", "stats", "machine"})
public record Report(
    long timestamp,
    long interval,
    List<ContainerSummary> stats,
    JsonNode machine
) {

    public Report {
        stats = stats != null ? List.copyOf(stats) : List.of();
    }
}
