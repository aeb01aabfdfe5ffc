package com.seorag.ingest;

/**
 * A build attempt that produced no committable index. The previous index, if any, stays active and
 * the whole build may be retried.
 */
public class BuildFailureException extends Exception {
    public BuildFailureException(String message) {
        super(message);
    }

    public BuildFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
