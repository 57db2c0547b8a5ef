package com.assetmetrics.history.exception;

/**
 * The upstream's calendar day kept changing while a read was in progress,
 * and the read was restarted more times than allowed.
 */
public class DayRolloverLimitExceededException extends MetricsReadException {

    private final int restarts;

    public DayRolloverLimitExceededException(String assetId, int restarts) {
        super(String.format(
            "Upstream day changed during read of '%s' after %d restarts", assetId, restarts));
        this.restarts = restarts;
    }

    public int getRestarts() {
        return restarts;
    }
}
