package com.di.statsrollup.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record NetworkSummary(
    @JsonProperty("tx_bytes") GaugeSummary txBytes,
    @JsonProperty("rx_bytes") GaugeSummary rxBytes,
    @JsonProperty("tx_packets") GaugeSummary txPackets,
    @JsonProperty("rx_packets") GaugeSummary rxPackets
) {}
