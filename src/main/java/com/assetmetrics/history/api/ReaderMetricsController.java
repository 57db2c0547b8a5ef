package com.assetmetrics.history.api;

import com.assetmetrics.history.reader.WindowedMetricsReader;
import com.assetmetrics.history.storage.ReadResultCache;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for monitoring the windowed reader and its cache.
 */
@RestController
@RequestMapping("/api/v1/reader")
@Tag(name = "Monitoring")
public class ReaderMetricsController {

    private final WindowedMetricsReader windowedReader;
    private final ReadResultCache cache;
    private final MeterRegistry meterRegistry;

    public ReaderMetricsController(
            WindowedMetricsReader windowedReader,
            ReadResultCache cache,
            MeterRegistry meterRegistry) {
        this.windowedReader = windowedReader;
        this.cache = cache;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Get reader metrics.
     *
     * Example response:
     * {
     *   "cachedResults": 42,
     *   "cacheHits": 120,
     *   "cacheMisses": 42,
     *   "windowedReads": 42,
     *   "upstreamFetches": 65,
     *   "windowEscalations": 3,
     *   "todaySupplements": 17,
     *   "dayRollovers": 0
     * }
     */
    @Operation(summary = "Get reader and cache counters")
    @GetMapping("/metrics")
    public ResponseEntity<ReaderMetricsResponse> getReaderMetrics() {
        return ResponseEntity.ok(new ReaderMetricsResponse(
            cache.size(),
            cache.hitCount(),
            cache.missCount(),
            windowedReader.getReads(),
            upstreamFetches(),
            windowedReader.getWindowEscalations(),
            windowedReader.getTodaySupplements(),
            windowedReader.getDayRollovers()
        ));
    }

    /**
     * Page requests sent upstream, failed ones included. Zero before the first fetch.
     */
    private long upstreamFetches() {
        Timer timer = meterRegistry.find("upstream.fetch.time").timer();
        return timer == null ? 0 : timer.count();
    }

    /**
     * Response DTO for reader metrics.
     */
    public record ReaderMetricsResponse(
        long cachedResults,
        long cacheHits,
        long cacheMisses,
        long windowedReads,
        long upstreamFetches,
        long windowEscalations,
        long todaySupplements,
        long dayRollovers
    ) {}
}
