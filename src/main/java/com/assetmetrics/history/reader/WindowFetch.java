package com.assetmetrics.history.reader;

import com.assetmetrics.history.domain.Entry;

import java.util.List;

/**
 * Samples fetched from one window, trimmed to the requested interval, with boundary coverage.
 *
 * @param entries Samples in [start, end), in upstream order
 * @param coversLeft First sample of the first page was at or before start
 * @param coversRight A sample at or after end was seen
 */
public record WindowFetch(
    List<Entry> entries,
    boolean coversLeft,
    boolean coversRight
) {

    public WindowFetch {
        entries = List.copyOf(entries);
    }

    public FetchOutcome outcome() {
        if (!coversLeft) {
            return FetchOutcome.NEEDS_WIDER;
        }
        return coversRight ? FetchOutcome.COVERED_BOTH : FetchOutcome.NEEDS_SUPPLEMENT;
    }
}
