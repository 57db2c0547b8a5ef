package com.assetmetrics.history.upstream;

import com.assetmetrics.history.domain.Page;
import com.assetmetrics.history.exception.UpstreamErrorException;
import com.assetmetrics.history.exception.UpstreamTransportException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicLong;

/**
 * HTTP implementation of {@link UpstreamClient}.
 *
 * Every call goes through the {@code upstream} circuit breaker, so a dead upstream
 * fails fast instead of tying up request threads. Nothing is retried here.
 */
public class HttpUpstreamClient implements UpstreamClient {

    private static final Logger log = LoggerFactory.getLogger(HttpUpstreamClient.class);

    private final RestClient restClient;
    private final PageDecoder decoder;
    private final CircuitBreaker circuitBreaker;
    private final MeterRegistry meterRegistry;

    private final AtomicLong upstreamErrors = new AtomicLong(0);

    public HttpUpstreamClient(
            RestClient restClient,
            PageDecoder decoder,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MeterRegistry meterRegistry) {
        this.restClient = restClient;
        this.decoder = decoder;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("upstream");
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge("upstream.errors", upstreamErrors);

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Upstream circuit breaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState())
            );
    }

    @Override
    public Page fetch(String url) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return circuitBreaker.executeSupplier(() -> doFetch(url));
        } catch (CallNotPermittedException e) {
            log.error("Upstream circuit breaker OPEN - rejecting fetch");
            throw new UpstreamTransportException("Upstream circuit breaker is open", e);
        } finally {
            sample.stop(meterRegistry.timer("upstream.fetch.time"));
        }
    }

    private Page doFetch(String url) {
        try {
            return restClient.get()
                .uri(URI.create(url))
                .exchange((request, response) -> {
                    int status = response.getStatusCode().value();
                    String body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);

                    // Status 400 or greater: the body is the error
                    if (status >= 400) {
                        upstreamErrors.incrementAndGet();
                        log.warn("Upstream returned status {}: {}", status, body);
                        throw new UpstreamErrorException(status, body);
                    }
                    return decoder.decode(body, response.getHeaders().getFirst(HttpHeaders.DATE));
                });
        } catch (ResourceAccessException e) {
            log.error("Failed to reach upstream: {}", e.getMessage());
            throw new UpstreamTransportException("Failed to reach upstream: " + e.getMessage(), e);
        }
    }
}
