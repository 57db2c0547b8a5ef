package com.assetmetrics.history.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Metrics configuration for query and upstream latency.
 *
 * Upstream reads are network bound (tens of milliseconds to seconds, longer when
 * a read pages through a 31 day window), so timer buckets are laid out on that scale.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> {
            registry.config().commonTags(
                "application", "asset-metrics-history-service",
                "environment", getEnvironment()
            );

            registry.config().meterFilter(new MeterFilter() {
                @Override
                public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                    if (id.getType() != Meter.Type.TIMER) {
                        return config;
                    }
                    return DistributionStatisticConfig.builder()
                        .percentiles(0.5, 0.95, 0.99)
                        .percentilePrecision(2)
                        // Timer SLOs are expressed in nanoseconds
                        .serviceLevelObjectives(
                            nanos(Duration.ofMillis(10)),
                            nanos(Duration.ofMillis(50)),
                            nanos(Duration.ofMillis(100)),
                            nanos(Duration.ofMillis(250)),
                            nanos(Duration.ofMillis(500)),
                            nanos(Duration.ofSeconds(1)),
                            nanos(Duration.ofSeconds(2)),
                            nanos(Duration.ofSeconds(5)),
                            nanos(Duration.ofSeconds(10))
                        )
                        .percentilesHistogram(true)
                        .expiry(Duration.ofMinutes(2))
                        .bufferLength(3)
                        .build()
                        .merge(config);
                }
            });
        };
    }

    private static double nanos(Duration duration) {
        return duration.toNanos();
    }

    /**
     * Detect environment from the active Spring profile.
     */
    private String getEnvironment() {
        String env = System.getenv("SPRING_PROFILES_ACTIVE");
        return env != null ? env : "local";
    }
}
