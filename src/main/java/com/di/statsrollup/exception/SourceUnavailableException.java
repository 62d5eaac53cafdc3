package com.di.statsrollup.exception;

/**
 * Thrown when the stats or host-metadata source cannot be read or decoded.
 * Fatal to the run: no partial report is sent.
 */
public class SourceUnavailableException extends RuntimeException {

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
