package com.di.statsrollup.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One container entry of the cAdvisor {@code /docker} response: its cgroup name,
 * the aliases Docker knows it by, and the per-second samples cAdvisor still holds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContainerInfo(
    String name,
    List<String> aliases,
    List<ContainerStats> stats
) {

    public ContainerInfo {
        aliases = aliases != null ? aliases.stream().filter(Objects::nonNull).toList() : List.of();
        // null samples are kept so the rollup can reject that one container
        stats = stats != null ? Collections.unmodifiableList(new ArrayList<>(stats)) : List.of();
    }
}
