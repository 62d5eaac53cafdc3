package com.di.statsrollup.model;

/** Byte deltas over the window, summed across all devices. */
public record DiskIoSummary(long async, long sync, long read, long write) {}
