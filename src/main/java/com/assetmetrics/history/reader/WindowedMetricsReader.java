package com.assetmetrics.history.reader;

import com.assetmetrics.history.domain.Entry;
import com.assetmetrics.history.domain.WindowName;
import com.assetmetrics.history.exception.DayRolloverLimitExceededException;
import com.assetmetrics.history.util.RangeSelector;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reads an exact [start, end) interval out of an upstream that only serves
 * relative windows ending at its own midnight.
 *
 * <p>Where start falls relative to the caller's UTC midnight decides the plan:
 * <ul>
 *   <li>Before midnight: query the narrowest past window covering start, widen
 *       once if the data does not reach back far enough, then add "today" if the
 *       past window stopped short of end.</li>
 *   <li>On or after midnight: query "today"; if it does not reach back to start
 *       the two clocks disagree, so add "yesterday" and re-read "today" when needed.</li>
 * </ul>
 *
 * <p>If the upstream's calendar day changes mid-read, everything fetched so far is
 * discarded and the read starts over, at most {@code maxDayRolloverRestarts} times.
 * A negative limit means no limit.
 *
 * <p>Thread-safe: all per-read state is local to {@link #read}.
 */
public class WindowedMetricsReader implements MetricsReader {

    private static final Logger log = LoggerFactory.getLogger(WindowedMetricsReader.class);

    private final WindowFetcher fetcher;
    private final RangeSelector rangeSelector;
    private final Clock clock;
    private final int maxDayRolloverRestarts;

    private final AtomicLong reads = new AtomicLong(0);
    private final AtomicLong windowEscalations = new AtomicLong(0);
    private final AtomicLong todaySupplements = new AtomicLong(0);
    private final AtomicLong dayRollovers = new AtomicLong(0);

    public WindowedMetricsReader(
            WindowFetcher fetcher,
            RangeSelector rangeSelector,
            Clock clock,
            int maxDayRolloverRestarts,
            MeterRegistry meterRegistry) {
        this.fetcher = fetcher;
        this.rangeSelector = rangeSelector;
        this.clock = clock;
        this.maxDayRolloverRestarts = maxDayRolloverRestarts;

        meterRegistry.gauge("reader.reads", reads);
        meterRegistry.gauge("reader.window.escalations", windowEscalations);
        meterRegistry.gauge("reader.today.supplements", todaySupplements);
        meterRegistry.gauge("reader.day.rollovers", dayRollovers);
    }

    @Override
    public List<Entry> read(String assetId, Instant start, Instant end) {
        Objects.requireNonNull(assetId, "Asset id cannot be null");
        Objects.requireNonNull(start, "Start cannot be null");
        Objects.requireNonNull(end, "End cannot be null");
        reads.incrementAndGet();

        int restarts = 0;
        while (true) {
            try {
                return readOnce(assetId, start, end);
            } catch (DayRolloverException e) {
                dayRollovers.incrementAndGet();
                if (maxDayRolloverRestarts >= 0 && restarts >= maxDayRolloverRestarts) {
                    log.error("Giving up read of {} after {} day rollover restarts", assetId, restarts);
                    throw new DayRolloverLimitExceededException(assetId, restarts);
                }
                restarts++;
                log.warn("Upstream day changed from {} to {} while reading {}; restarting (attempt {})",
                    e.getPreviousDay(), e.getCurrentDay(), assetId, restarts + 1);
            }
        }
    }

    private List<Entry> readOnce(String assetId, Instant start, Instant end) {
        Instant midnight = clock.instant().truncatedTo(ChronoUnit.DAYS);
        SkewGuard skewGuard = new SkewGuard();

        if (start.isBefore(midnight)) {
            return readFromPastWindow(assetId, start, end, midnight, skewGuard);
        }
        return readFromToday(assetId, start, end, skewGuard);
    }

    private List<Entry> readFromPastWindow(
            String assetId, Instant start, Instant end, Instant midnight, SkewGuard skewGuard) {

        WindowName window = rangeSelector.selectWindow(Duration.between(start, midnight));
        WindowFetch past = fetcher.fetch(assetId, window, start, end, skewGuard, true);

        switch (past.outcome()) {
            case NEEDS_WIDER -> {
                // Window did not reach back to start: probable clock skew, drop it and go one rung wider
                WindowName wider = rangeSelector.widen(window);
                windowEscalations.incrementAndGet();
                log.warn("Window {} for {} starts after {}; widening to {}", window, assetId, start, wider);
                past = fetcher.fetch(assetId, wider, start, end, skewGuard, false);
            }
            case COVERED_BOTH, NEEDS_SUPPLEMENT -> log.debug("Window {} for {} reaches back to {}", window, assetId, start);
        }

        List<Entry> entries = new ArrayList<>(past.entries());

        // Past windows stop at upstream midnight
        if (!past.coversRight()) {
            todaySupplements.incrementAndGet();
            entries.addAll(fetcher.fetch(assetId, WindowName.TODAY, start, end, skewGuard, false).entries());
        }
        return entries;
    }

    private List<Entry> readFromToday(String assetId, Instant start, Instant end, SkewGuard skewGuard) {
        WindowFetch today = fetcher.fetch(assetId, WindowName.TODAY, start, end, skewGuard, true);

        switch (today.outcome()) {
            case COVERED_BOTH, NEEDS_SUPPLEMENT -> {
                return new ArrayList<>(today.entries());
            }
            case NEEDS_WIDER -> {
                windowEscalations.incrementAndGet();
                log.warn("Upstream 'today' for {} starts after {}; reading 'yesterday' as well", assetId, start);
            }
        }

        WindowFetch yesterday = fetcher.fetch(assetId, WindowName.YESTERDAY, start, end, skewGuard, false);
        List<Entry> entries = new ArrayList<>(yesterday.entries());

        // The upstream day boundary may have moved between calls
        if (!yesterday.coversRight()) {
            todaySupplements.incrementAndGet();
            entries.addAll(fetcher.fetch(assetId, WindowName.TODAY, start, end, skewGuard, false).entries());
        }
        return entries;
    }

    public long getWindowEscalations() {
        return windowEscalations.get();
    }

    public long getTodaySupplements() {
        return todaySupplements.get();
    }

    public long getDayRollovers() {
        return dayRollovers.get();
    }

    public long getReads() {
        return reads.get();
    }
}
