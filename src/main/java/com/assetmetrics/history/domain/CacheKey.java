package com.assetmetrics.history.domain;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Exact-match key for a memoized read.
 * Start and end are UTC instants, so the same moment expressed in different
 * zones maps to the same key.
 */
public record CacheKey(
    String assetId,
    Instant start,
    Instant end
) {

    public CacheKey {
        Objects.requireNonNull(assetId, "Asset id cannot be null");
        Objects.requireNonNull(start, "Start cannot be null");
        Objects.requireNonNull(end, "End cannot be null");
    }

    public static CacheKey of(String assetId, ZonedDateTime start, ZonedDateTime end) {
        return new CacheKey(assetId, start.toInstant(), end.toInstant());
    }
}
