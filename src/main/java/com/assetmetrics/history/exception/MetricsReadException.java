package com.assetmetrics.history.exception;

/**
 * Base type for failures reading metric history from the upstream.
 * Read failures are never cached and never retried by the reader.
 */
public abstract class MetricsReadException extends RuntimeException {

    protected MetricsReadException(String message) {
        super(message);
    }

    protected MetricsReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
