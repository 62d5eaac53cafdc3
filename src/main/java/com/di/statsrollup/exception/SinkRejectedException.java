package com.di.statsrollup.exception;

/**
 * Thrown when the collector answers with a non-success status or cannot be reached.
 * Fatal to the run; there is no local retry, the next scheduled invocation is the retry.
 */
public class SinkRejectedException extends RuntimeException {

    private final int statusCode;

    public SinkRejectedException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status returned by the collector, or -1 when the request never got a response. */
    public int getStatusCode() {
        return statusCode;
    }
}
