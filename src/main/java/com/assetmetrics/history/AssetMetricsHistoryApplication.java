package com.assetmetrics.history;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Asset Metrics History Service
 *
 * Serves exact-interval metric history for cloud assets out of an upstream API
 * that only knows fixed relative windows (yesterday, last_2_days, ... today).
 *
 * Key Features:
 * - Window selection with escalation when upstream and local clocks disagree
 * - Restart of reads that straddle an upstream day change
 * - Memoized results for repeated intervals
 * - OpenTSDB-compatible query API for dashboards
 * - Prometheus metrics via actuator
 *
 * @since 1.0.0
 */
@SpringBootApplication
public class AssetMetricsHistoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(AssetMetricsHistoryApplication.class, args);
    }
}
