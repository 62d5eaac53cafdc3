package com.di.statsrollup.rollup;

/**
 * What to do when a cumulative counter ends a window lower than it started,
 * which happens when the container restarts mid-window.
 */
public enum CounterResetPolicy {
    /** Report the negative delta as is. */
    PASS_THROUGH,
    /** Report 0 instead of the negative delta. */
    CLAMP_TO_ZERO,
    /** Fail the container's rollup with {@link com.di.statsrollup.exception.CounterResetException}. */
    FAIL
}
