package com.assetmetrics.history.reader;

import com.assetmetrics.history.domain.Entry;
import com.assetmetrics.history.domain.Page;
import com.assetmetrics.history.domain.WindowName;
import com.assetmetrics.history.upstream.UpstreamClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetches one named window for one asset, pages through it and trims the
 * samples to the requested half-open interval.
 *
 * Not thread-safe with respect to the {@link SkewGuard} passed in; the fetcher itself holds no per-read state.
 */
public class WindowFetcher {

    private static final Logger log = LoggerFactory.getLogger(WindowFetcher.class);

    private final UpstreamClient upstream;
    private final String baseUrl;
    private final String apiKey;

    public WindowFetcher(UpstreamClient upstream, String baseUrl, String apiKey) {
        this.upstream = upstream;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
    }

    /**
     * Fetches the window and returns the samples in [start, end).
     *
     * @param assetId Upstream asset id, passed through untouched
     * @param window Window to query
     * @param start Interval start (inclusive)
     * @param end Interval end (exclusive)
     * @param skewGuard Day tracker of the current read
     * @param exitEarly Stop after the first page if it does not reach back to start
     * @return Trimmed samples with coverage flags
     * @throws DayRolloverException if the upstream's day changes between responses of this read
     */
    public WindowFetch fetch(
            String assetId,
            WindowName window,
            Instant start,
            Instant end,
            SkewGuard skewGuard,
            boolean exitEarly) {

        Page page = fetchPage(buildUrl(assetId, window), skewGuard);
        List<Entry> batch = page.entries();

        boolean coversLeft = !batch.isEmpty() && !batch.get(0).time().isAfter(start);

        List<Entry> result = new ArrayList<>();
        Span span = findSpan(batch, start, end);
        appendSpan(result, batch, span, start, end);

        if (!coversLeft && exitEarly) {
            log.debug("Window {} for {} does not reach back to {}, exiting early", window, assetId, start);
            return new WindowFetch(result, false, false);
        }

        int pages = 1;
        while (true) {
            // Saw a sample at or after end: nothing more to read
            if (span.endIdx() < batch.size()) {
                log.debug("Window {} for {}: {} entries from {} pages", window, assetId, result.size(), pages);
                return new WindowFetch(result, coversLeft, true);
            }
            if (!page.hasNext()) {
                log.debug("Window {} for {}: {} entries from {} pages, end not reached",
                    window, assetId, result.size(), pages);
                return new WindowFetch(result, coversLeft, false);
            }
            page = fetchPage(page.next(), skewGuard);
            pages++;
            batch = page.entries();
            span = findSpan(batch, start, end);
            appendSpan(result, batch, span, start, end);
        }
    }

    /**
     * Builds the first-page URL for a window. The page parameter is omitted.
     */
    public String buildUrl(String assetId, WindowName window) {
        return UriComponentsBuilder.fromUriString(baseUrl)
            .queryParam("api_key", "{apiKey}")
            .queryParam("asset", "{asset}")
            .queryParam("time_range", "{timeRange}")
            .encode()
            .buildAndExpand(apiKey, assetId, window.wireName())
            .toUriString();
    }

    private Page fetchPage(String url, SkewGuard skewGuard) {
        Page page = upstream.fetch(url);
        skewGuard.observe(page.batchDay());
        return page;
    }

    /**
     * Finds the first index with time >= start, then from there the first index with
     * time >= end. A linear scan rather than a binary search: upstream pages are not
     * guaranteed to be sorted.
     */
    static Span findSpan(List<Entry> entries, Instant start, Instant end) {
        int size = entries.size();
        int startIdx = 0;
        while (startIdx < size && entries.get(startIdx).time().isBefore(start)) {
            startIdx++;
        }
        int endIdx = startIdx;
        while (endIdx < size && entries.get(endIdx).time().isBefore(end)) {
            endIdx++;
        }
        return new Span(startIdx, endIdx);
    }

    // Out-of-order samples can sit inside the span; they never reach the caller
    private static void appendSpan(List<Entry> sink, List<Entry> batch, Span span, Instant start, Instant end) {
        for (Entry entry : batch.subList(span.startIdx(), span.endIdx())) {
            if (entry.isWithin(start, end)) {
                sink.add(entry);
            }
        }
    }

    record Span(int startIdx, int endIdx) {}
}
