package com.di.statsrollup.exception;

/** Thrown when a container's window holds no samples, so no summary can be computed. */
public class EmptyWindowException extends RollupException {

    public EmptyWindowException(String containerName) {
        super("Window for container '" + containerName + "' has no samples");
    }
}
