package com.di.statsrollup.rollup;

import java.util.OptionalLong;

/**
 * Running total, minimum and maximum of one series, fed one value at a time.
 *
 * <p>Immutable: {@link #update(long)} returns the next state. Minimum and maximum are empty
 * until the first value arrives; afterwards they only move on a strictly smaller or larger
 * value, so ties keep the extremum already held. No numeric sentinel is involved, so zero and
 * negative readings are ordinary values.
 */
public final class RunningAggregate {

    private static final RunningAggregate EMPTY = new RunningAggregate(0L, 0L, 0L, false);

    private final long total;
    private final long min;
    private final long max;
    private final boolean seen;

    private RunningAggregate(long total, long min, long max, boolean seen) {
        this.total = total;
        this.min = min;
        this.max = max;
        this.seen = seen;
    }

    public static RunningAggregate empty() {
        return EMPTY;
    }

    public RunningAggregate update(long value) {
        long nextMin = !seen || value < min ? value : min;
        long nextMax = !seen || value > max ? value : max;
        return new RunningAggregate(total + value, nextMin, nextMax, true);
    }

    public long getTotal() {
        return total;
    }

    public OptionalLong getMin() {
        return seen ? OptionalLong.of(min) : OptionalLong.empty();
    }

    public OptionalLong getMax() {
        return seen ? OptionalLong.of(max) : OptionalLong.empty();
    }

    public boolean isEmpty() {
        return !seen;
    }

    /**
     * Total divided by {@code sampleCount}.
     *
     * @throws IllegalArgumentException if {@code sampleCount} is not positive
     */
    public double average(int sampleCount) {
        if (sampleCount <= 0) {
            throw new IllegalArgumentException("sampleCount must be positive, got " + sampleCount);
        }
        return (double) total / sampleCount;
    }

    @Override
    public String toString() {
        return seen
                ? "RunningAggregate{total=" + total + ", min=" + min + ", max=" + max + "}"
                : "RunningAggregate{empty}";
    }
}
