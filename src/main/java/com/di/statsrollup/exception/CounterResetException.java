package com.di.statsrollup.exception;

/**
 * Thrown under {@link com.di.statsrollup.rollup.CounterResetPolicy#FAIL} when a cumulative
 * counter went backwards inside the window, typically after a container restart.
 */
public class CounterResetException extends RollupException {

    public CounterResetException(String counter, long first, long last) {
        super("Counter '" + counter + "' went backwards within the window: first=" + first + ", last=" + last);
    }
}
