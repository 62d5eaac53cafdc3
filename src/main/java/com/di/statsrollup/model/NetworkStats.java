package com.di.statsrollup.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Network totals of a sample (first interface, as cAdvisor flattens it). Drop and error counters are ignored. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NetworkStats(
    @JsonProperty("tx_bytes") long txBytes,
    @JsonProperty("rx_bytes") long rxBytes,
    @JsonProperty("tx_packets") long txPackets,
    @JsonProperty("rx_packets") long rxPackets
) {}
