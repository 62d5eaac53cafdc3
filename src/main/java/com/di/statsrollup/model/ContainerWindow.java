package com.di.statsrollup.model;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered samples of one container for one collection interval, under its selected display name.
 * The sample count is whatever the source returned; nothing assumes a fixed length.
 */
public record ContainerWindow(
    String name,
    List<ContainerStats> samples
) {

    public ContainerWindow {
        samples = samples != null ? Collections.unmodifiableList(new ArrayList<>(samples)) : List.of();
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public ContainerStats first() {
        return samples.get(0);
    }

    public ContainerStats last() {
        return samples.get(samples.size() - 1);
    }

    /**
     * Epoch seconds of the first sample.
     *
     * @throws IllegalArgumentException if the first sample carries no parsable RFC 3339 timestamp
     */
    public long windowStartEpochSeconds() {
        String ts = first().timestamp();
        if (ts == null || ts.isBlank()) {
            throw new IllegalArgumentException("First sample of '" + name + "' has no timestamp");
        }
        try {
            return OffsetDateTime.parse(ts).toEpochSecond();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unparsable sample timestamp '" + ts + "' for '" + name + "'", e);
        }
    }
}
