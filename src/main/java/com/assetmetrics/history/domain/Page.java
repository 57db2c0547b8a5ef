package com.assetmetrics.history.domain;

import java.time.LocalDate;
import java.util.List;

/**
 * One page of samples returned by the upstream.
 * Entries carry no ordering guarantee.
 *
 * @param entries Samples on this page
 * @param next URL of the following page, empty when this is the last page
 * @param batchDay UTC calendar day reported by the upstream for this response, or null if unknown
 */
public record Page(
    List<Entry> entries,
    String next,
    LocalDate batchDay
) {

    public Page {
        entries = entries == null ? List.of() : List.copyOf(entries);
        next = next == null ? "" : next;
    }

    public static Page last(List<Entry> entries, LocalDate batchDay) {
        return new Page(entries, "", batchDay);
    }

    public boolean hasNext() {
        return !next.isEmpty();
    }
}
