package com.assetmetrics.history.storage;

import com.assetmetrics.history.domain.CacheKey;
import com.assetmetrics.history.domain.Entry;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Caffeine-backed implementation of {@link ReadResultCache}.
 *
 * Each key maps to the future of its load. The first caller for a key installs the
 * future and runs the load on its own thread; concurrent callers for that key join it.
 * No map lock is held while loading, so a slow upstream read never blocks other keys.
 * Caffeine drops futures that complete exceptionally, so failed loads leave nothing behind.
 *
 * Unbounded: results are kept for the life of the process.
 */
public class InMemoryReadResultCache implements ReadResultCache {

    private static final Logger log = LoggerFactory.getLogger(InMemoryReadResultCache.class);

    private final AsyncCache<CacheKey, List<Entry>> results = Caffeine.newBuilder().buildAsync();

    private final AtomicLong hitCounter = new AtomicLong(0);
    private final AtomicLong missCounter = new AtomicLong(0);
    private final AtomicLong loadFailureCounter = new AtomicLong(0);

    @Override
    public List<Entry> getOrLoad(CacheKey key, Supplier<List<Entry>> loader) {
        CompletableFuture<List<Entry>> pending = new CompletableFuture<>();
        CompletableFuture<List<Entry>> existing = results.asMap().putIfAbsent(key, pending);
        if (existing != null) {
            hitCounter.incrementAndGet();
            return join(existing);
        }

        missCounter.incrementAndGet();
        List<Entry> loaded;
        try {
            loaded = List.copyOf(loader.get());
        } catch (RuntimeException e) {
            loadFailureCounter.incrementAndGet();
            results.asMap().remove(key, pending);
            pending.completeExceptionally(e);
            throw e;
        }
        pending.complete(loaded);

        if (log.isTraceEnabled()) {
            log.trace("Cached read: asset={}, start={}, end={}, entries={}",
                key.assetId(), key.start(), key.end(), loaded.size());
        }
        return loaded;
    }

    @Override
    public Optional<List<Entry>> find(CacheKey key) {
        CompletableFuture<List<Entry>> future = results.getIfPresent(key);
        if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.of(future.join());
    }

    @Override
    public long size() {
        return results.synchronous().estimatedSize();
    }

    @Override
    public long hitCount() {
        return hitCounter.get();
    }

    @Override
    public long missCount() {
        return missCounter.get();
    }

    public long getLoadFailureCount() {
        return loadFailureCounter.get();
    }

    /**
     * Waits for another caller's load. Its failure is rethrown as-is.
     */
    private static List<Entry> join(CompletableFuture<List<Entry>> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }
}
