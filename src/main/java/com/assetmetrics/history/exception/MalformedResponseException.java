package com.assetmetrics.history.exception;

/**
 * The upstream payload could not be decoded into samples.
 */
public class MalformedResponseException extends MetricsReadException {

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
