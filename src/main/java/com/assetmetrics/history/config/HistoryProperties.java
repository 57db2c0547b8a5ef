package com.assetmetrics.history.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Externalized configuration for the history service.
 * Maps to 'history.*' properties in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "history")
public class HistoryProperties {

    private Upstream upstream = new Upstream();
    private Reader reader = new Reader();

    @Data
    public static class Upstream {
        private String baseUrl = "https://chapi.cloudhealthtech.com/metrics/v1";
        private String apiKey = "";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Reader {
        private int maxDayRolloverRestarts = 3;  // negative = restart forever
    }
}
