package com.di.statsrollup.model;

/** CPU usage delta over the window plus the load gauge. */
public record CpuSummary(long usage, GaugeSummary load) {}
