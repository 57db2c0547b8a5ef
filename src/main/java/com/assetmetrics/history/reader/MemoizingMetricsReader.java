package com.assetmetrics.history.reader;

import com.assetmetrics.history.domain.CacheKey;
import com.assetmetrics.history.domain.Entry;
import com.assetmetrics.history.storage.ReadResultCache;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Memoizes another {@link MetricsReader} by exact (asset, start, end).
 *
 * <p>Closed past intervals never change upstream, so results are kept for the
 * life of the process. Intervals ending at a moving "now" produce a new key on
 * every call instead of stale data. Failed reads are never stored.
 *
 * <p>Each call returns a new list: callers may reorder, truncate or null out their
 * copy freely. The {@link Entry} values themselves are shared with the cache
 * (shallow copy); they are immutable.
 */
public class MemoizingMetricsReader implements MetricsReader {

    private static final Logger log = LoggerFactory.getLogger(MemoizingMetricsReader.class);

    private final MetricsReader delegate;
    private final ReadResultCache cache;

    public MemoizingMetricsReader(MetricsReader delegate, ReadResultCache cache, MeterRegistry meterRegistry) {
        this.delegate = Objects.requireNonNull(delegate, "Delegate reader cannot be null");
        this.cache = Objects.requireNonNull(cache, "Cache cannot be null");

        meterRegistry.gauge("reader.cache.size", cache, ReadResultCache::size);
        meterRegistry.gauge("reader.cache.hits", cache, ReadResultCache::hitCount);
        meterRegistry.gauge("reader.cache.misses", cache, ReadResultCache::missCount);
    }

    @Override
    public List<Entry> read(String assetId, Instant start, Instant end) {
        CacheKey key = new CacheKey(assetId, start, end);
        List<Entry> result = cache.getOrLoad(key, () -> {
            log.debug("Cache miss: asset={}, start={}, end={}", assetId, start, end);
            return delegate.read(assetId, start, end);
        });
        return new ArrayList<>(result);
    }
}
