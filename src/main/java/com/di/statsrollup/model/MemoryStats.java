package com.di.statsrollup.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Memory section of a sample; usage in bytes. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MemoryStats(long usage) {}
