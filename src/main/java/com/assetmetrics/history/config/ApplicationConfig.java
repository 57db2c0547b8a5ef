package com.assetmetrics.history.config;

import com.assetmetrics.history.reader.MemoizingMetricsReader;
import com.assetmetrics.history.reader.MetricsReader;
import com.assetmetrics.history.reader.WindowFetcher;
import com.assetmetrics.history.reader.WindowedMetricsReader;
import com.assetmetrics.history.storage.InMemoryReadResultCache;
import com.assetmetrics.history.storage.ReadResultCache;
import com.assetmetrics.history.upstream.HttpUpstreamClient;
import com.assetmetrics.history.upstream.PageDecoder;
import com.assetmetrics.history.upstream.UpstreamClient;
import com.assetmetrics.history.util.RangeSelector;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/**
 * Spring configuration for core application beans.
 */
@Configuration
public class ApplicationConfig {

    private static final Logger log = LoggerFactory.getLogger(ApplicationConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RangeSelector rangeSelector() {
        return new RangeSelector();
    }

    @Bean
    public RestClient upstreamRestClient(HistoryProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getUpstream().getConnectTimeout());
        requestFactory.setReadTimeout(properties.getUpstream().getReadTimeout());
        return RestClient.builder()
            .requestFactory(requestFactory)
            .build();
    }

    @Bean
    public UpstreamClient upstreamClient(
            RestClient upstreamRestClient,
            ObjectMapper objectMapper,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MeterRegistry meterRegistry) {
        return new HttpUpstreamClient(
            upstreamRestClient, new PageDecoder(objectMapper), circuitBreakerRegistry, meterRegistry);
    }

    @Bean
    public WindowedMetricsReader windowedMetricsReader(
            UpstreamClient upstreamClient,
            RangeSelector rangeSelector,
            Clock clock,
            HistoryProperties properties,
            MeterRegistry meterRegistry) {
        HistoryProperties.Upstream upstream = properties.getUpstream();
        if (upstream.getApiKey() == null || upstream.getApiKey().isBlank()) {
            log.warn("history.upstream.api-key is not set; upstream requests will be rejected");
        }
        WindowFetcher fetcher = new WindowFetcher(upstreamClient, upstream.getBaseUrl(), upstream.getApiKey());
        return new WindowedMetricsReader(
            fetcher,
            rangeSelector,
            clock,
            properties.getReader().getMaxDayRolloverRestarts(),
            meterRegistry);
    }

    @Bean
    public ReadResultCache readResultCache() {
        return new InMemoryReadResultCache();
    }

    @Bean
    @Primary
    public MetricsReader metricsReader(
            WindowedMetricsReader windowedMetricsReader,
            ReadResultCache readResultCache,
            MeterRegistry meterRegistry) {
        return new MemoizingMetricsReader(windowedMetricsReader, readResultCache, meterRegistry);
    }
}
