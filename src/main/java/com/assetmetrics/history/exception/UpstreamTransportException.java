package com.assetmetrics.history.exception;

/**
 * The upstream could not be reached (connection, I/O or timeout failure),
 * or the upstream circuit breaker is open.
 */
public class UpstreamTransportException extends MetricsReadException {

    public UpstreamTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
