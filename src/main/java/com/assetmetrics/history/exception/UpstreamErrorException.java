package com.assetmetrics.history.exception;

/**
 * The upstream answered with HTTP status 400 or greater.
 * The message is the raw response body; credential rejections arrive here too
 * and can only be told apart by that text.
 */
public class UpstreamErrorException extends MetricsReadException {

    private final int statusCode;

    public UpstreamErrorException(int statusCode, String body) {
        super(body);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
