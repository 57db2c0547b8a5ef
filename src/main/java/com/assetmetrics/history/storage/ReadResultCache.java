package com.assetmetrics.history.storage;

import com.assetmetrics.history.domain.CacheKey;
import com.assetmetrics.history.domain.Entry;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Store of completed read results keyed by exact interval.
 * Abstracts the storage and its concurrency discipline away from the memoizing reader.
 *
 * Entries are kept for the life of the process; there is no expiry and no eviction.
 */
public interface ReadResultCache {

    /**
     * Returns the cached result for the key, loading it on a miss.
     * Implementations must run at most one load per key at a time; concurrent
     * callers for the same key wait for it and share its result.
     * A load that throws stores nothing and the exception reaches the caller.
     *
     * @param key The exact interval key
     * @param loader Performs the read on a miss
     * @return The stored, unmodifiable result
     */
    List<Entry> getOrLoad(CacheKey key, Supplier<List<Entry>> loader);

    /**
     * Looks up a stored result without loading.
     *
     * @param key The exact interval key
     * @return Optional containing the stored result if present
     */
    Optional<List<Entry>> find(CacheKey key);

    /**
     * Returns the number of stored results.
     *
     * @return Count of cache entries
     */
    long size();

    /** Number of lookups served from the cache. */
    long hitCount();

    /** Number of lookups that had to load. */
    long missCount();
}
