package com.assetmetrics.history.reader;

import com.assetmetrics.history.domain.Entry;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Reads the metric history of one asset over an exact half-open interval.
 */
public interface MetricsReader {

    /**
     * Reads all samples with {@code start <= time < end}.
     * The result is in the order the upstream delivered it and is not re-sorted.
     *
     * @param assetId Upstream asset id, e.g. "arn:aws:ec2:us-east-1:12345678901:instance/i-12345678"
     * @param start Start of the interval (inclusive)
     * @param end End of the interval (exclusive)
     * @return Samples in the interval, possibly empty
     * @throws com.assetmetrics.history.exception.MetricsReadException if the upstream read fails
     */
    List<Entry> read(String assetId, Instant start, Instant end);

    /**
     * Zone-aware variant; the interval is normalized to UTC instants.
     */
    default List<Entry> read(String assetId, ZonedDateTime start, ZonedDateTime end) {
        return read(assetId, start.toInstant(), end.toInstant());
    }
}
