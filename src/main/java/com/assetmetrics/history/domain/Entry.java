package com.assetmetrics.history.domain;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable set of metric values sampled for one asset at one instant.
 * Produced from one upstream sample group; shared between cached results and callers.
 *
 * @param time Sample timestamp
 * @param values Metric name to value (unmodifiable copy)
 */
public record Entry(
    Instant time,
    Map<String, Double> values
) {

    public Entry {
        Objects.requireNonNull(time, "Time cannot be null");
        values = values == null ? Map.of() : Map.copyOf(values);
    }

    /** Creates an entry carrying no metric values. */
    public static Entry at(Instant time) {
        return new Entry(time, Map.of());
    }

    /** Returns true if the sample falls inside the half-open interval [start, end). */
    public boolean isWithin(Instant start, Instant end) {
        return !time.isBefore(start) && time.isBefore(end);
    }
}
