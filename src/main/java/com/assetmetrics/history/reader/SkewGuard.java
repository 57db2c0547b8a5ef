package com.assetmetrics.history.reader;

import java.time.LocalDate;

/**
 * Tracks the calendar day the upstream reports across the fetches of one read.
 * A fresh guard is used for every read attempt. Not thread-safe.
 */
public class SkewGuard {

    private LocalDate lastDay;

    /**
     * Records the day reported by one upstream response.
     *
     * @param batchDay Day reported by the upstream, or null if the response carried none
     * @throws DayRolloverException if the day differs from the previously observed one
     */
    public void observe(LocalDate batchDay) {
        if (batchDay == null) {
            return;
        }
        LocalDate previous = lastDay;
        lastDay = batchDay;
        if (previous != null && !previous.equals(batchDay)) {
            throw new DayRolloverException(previous, batchDay);
        }
    }

    /** Last day observed, or null before the first observation. */
    public LocalDate lastDay() {
        return lastDay;
    }
}
