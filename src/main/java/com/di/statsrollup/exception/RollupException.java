package com.di.statsrollup.exception;

/**
 * Base of all failures that are confined to a single container's rollup.
 *
 * <p>Caught by {@link com.di.statsrollup.job.RollupJobService}: the container is left out
 * of the report and the run carries on with the others.
 */
public class RollupException extends RuntimeException {

    public RollupException(String message) {
        super(message);
    }

    public RollupException(String message, Throwable cause) {
        super(message, cause);
    }
}
