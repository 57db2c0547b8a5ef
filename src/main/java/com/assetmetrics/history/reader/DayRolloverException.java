package com.assetmetrics.history.reader;

import java.time.LocalDate;

/**
 * Signals that the upstream's calendar day changed in the middle of a read.
 * Never leaves the reader; the read is restarted from scratch.
 */
class DayRolloverException extends RuntimeException {

    private final LocalDate previousDay;
    private final LocalDate currentDay;

    DayRolloverException(LocalDate previousDay, LocalDate currentDay) {
        super("Upstream day changed from " + previousDay + " to " + currentDay, null, false, false);
        this.previousDay = previousDay;
        this.currentDay = currentDay;
    }

    LocalDate getPreviousDay() {
        return previousDay;
    }

    LocalDate getCurrentDay() {
        return currentDay;
    }
}
