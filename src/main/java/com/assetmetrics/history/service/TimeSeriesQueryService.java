package com.assetmetrics.history.service;

import com.assetmetrics.history.domain.Asset;
import com.assetmetrics.history.domain.DataPoint;
import com.assetmetrics.history.domain.Entry;
import com.assetmetrics.history.reader.MetricsReader;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Service layer turning single-metric time series queries into asset reads.
 *
 * Responsibilities:
 * - Input validation
 * - Choosing the upstream asset id (file-system metrics live on their own asset)
 * - Extracting one metric from multi-metric samples
 *
 * Read failures propagate unchanged; the API layer maps them to HTTP statuses.
 */
@Service
public class TimeSeriesQueryService {

    private static final Logger log = LoggerFactory.getLogger(TimeSeriesQueryService.class);

    static final String FILE_SYSTEM_PREFIX = "fs:";

    private final MetricsReader reader;

    private final AtomicLong validationErrors = new AtomicLong(0);

    public TimeSeriesQueryService(MetricsReader reader, MeterRegistry meterRegistry) {
        this.reader = reader;
        meterRegistry.gauge("query.service.validation.errors", validationErrors);
    }

    /**
     * Fetches the time series of one metric of one asset.
     *
     * @param asset The machine to read
     * @param metric Metric name, e.g. "cpu:used:percent.avg" or "fs:space.used:bytes.avg"
     * @param startMillis Start time in milliseconds since epoch (inclusive)
     * @param endMillis End time in milliseconds since epoch (exclusive)
     * @return Data points in read order; empty if the metric has no samples in range
     * @throws ValidationException if the asset or metric is incomplete
     */
    public List<DataPoint> fetch(Asset asset, String metric, long startMillis, long endMillis) {
        validateInputs(asset, metric);

        boolean fileSystemMetric = metric.startsWith(FILE_SYSTEM_PREFIX);
        List<Entry> entries = reader.read(
            asset.toAssetId(fileSystemMetric),
            Instant.ofEpochMilli(startMillis),
            Instant.ofEpochMilli(endMillis));

        List<DataPoint> result = new ArrayList<>();
        for (Entry entry : entries) {
            Double value = entry.values().get(metric);
            if (value != null) {
                result.add(new DataPoint(entry.time().getEpochSecond(), value));
            }
        }

        log.debug("Time series query: asset={}, metric={}, from={}, to={}, entries={}, points={}",
            asset.instanceId(), metric, startMillis, endMillis, entries.size(), result.size());
        return result;
    }

    private void validateInputs(Asset asset, String metric) {
        if (asset == null || !asset.isComplete()) {
            validationErrors.incrementAndGet();
            throw new ValidationException("region, accountNumber, and instanceId tags required");
        }
        if (metric == null || metric.isBlank()) {
            validationErrors.incrementAndGet();
            throw new ValidationException("Metric cannot be null or blank");
        }
    }

    /**
     * Business logic validation exception.
     */
    public static class ValidationException extends RuntimeException {
        public ValidationException(String message) {
            super(message);
        }
    }
}
