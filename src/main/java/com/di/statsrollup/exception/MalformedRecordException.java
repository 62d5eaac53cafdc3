package com.di.statsrollup.exception;

/** Thrown when a sample lacks a section or list the rollup depends on. */
public class MalformedRecordException extends RollupException {

    public MalformedRecordException(String message) {
        super(message);
    }

    public MalformedRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
