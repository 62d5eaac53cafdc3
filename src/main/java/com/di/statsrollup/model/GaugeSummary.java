package com.di.statsrollup.model;

/**
 * Average, minimum and maximum of one gauge over a window.
 * Serialized as {@code {"ave": .., "min": .., "max": ..}}.
 */
public record GaugeSummary(double ave, long min, long max) {}
