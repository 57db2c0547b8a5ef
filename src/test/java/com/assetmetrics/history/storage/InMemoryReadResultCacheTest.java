package com.assetmetrics.history.storage;

import com.assetmetrics.history.domain.CacheKey;
import com.assetmetrics.history.domain.Entry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryReadResultCache}.
 *
 * <p><b>Coverage Areas:</b>
 * <ul>
 *   <li>Hit and miss accounting</li>
 *   <li>Single load for concurrent identical requests</li>
 *   <li>Failed loads are not stored</li>
 * </ul>
 */
@DisplayName("InMemoryReadResultCache Tests")
class InMemoryReadResultCacheTest {

    private static final Instant START = Instant.parse("2017-06-20T09:00:00Z");
    private static final Instant END = Instant.parse("2017-06-20T12:00:00Z");

    private InMemoryReadResultCache cache;
    private CacheKey key;

    @BeforeEach
    void setUp() {
        cache = new InMemoryReadResultCache();
        key = new CacheKey("asset", START, END);
    }

    @Test
    @DisplayName("Should load once and serve later calls from memory")
    void testLoadOnce() {
        AtomicInteger loads = new AtomicInteger();

        List<Entry> first = cache.getOrLoad(key, () -> {
            loads.incrementAndGet();
            return List.of(Entry.at(START));
        });
        List<Entry> second = cache.getOrLoad(key, () -> {
            loads.incrementAndGet();
            return List.of();
        });

        assertThat(second).isEqualTo(first);
        assertThat(loads.get()).isEqualTo(1);
        assertThat(cache.hitCount()).isEqualTo(1);
        assertThat(cache.missCount()).isEqualTo(1);
        assertThat(cache.find(key)).isPresent();
    }

    @Test
    @DisplayName("Should store an immutable copy of the loaded list")
    void testStoredCopy() {
        List<Entry> loaded = new ArrayList<>(List.of(Entry.at(START)));

        cache.getOrLoad(key, () -> loaded);
        loaded.clear();

        assertThat(cache.find(key)).hasValueSatisfying(entries -> assertThat(entries).hasSize(1));
        assertThatThrownBy(() -> cache.find(key).orElseThrow().add(Entry.at(END)))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should not store failed loads")
    void testFailureNotCached() {
        assertThatThrownBy(() -> cache.getOrLoad(key, () -> {
            throw new IllegalStateException("upstream down");
        })).isInstanceOf(IllegalStateException.class).hasMessage("upstream down");

        assertThat(cache.find(key)).isEmpty();
        assertThat(cache.getLoadFailureCount()).isEqualTo(1);

        List<Entry> retried = cache.getOrLoad(key, () -> List.of(Entry.at(START)));
        assertThat(retried).hasSize(1);
    }

    @Test
    @DisplayName("Should leave nothing behind when loads for many keys fail")
    void testFailuresLeaveNoResidue() {
        for (int i = 0; i < 1000; i++) {
            CacheKey failing = new CacheKey("asset-" + i, START, END);
            assertThatThrownBy(() -> cache.getOrLoad(failing, () -> {
                throw new IllegalStateException("upstream down");
            })).isInstanceOf(IllegalStateException.class);
        }

        assertThat(cache.size()).isZero();
        assertThat(cache.getLoadFailureCount()).isEqualTo(1000);
        assertThat(cache.missCount()).isEqualTo(1000);
        assertThat(cache.find(new CacheKey("asset-7", START, END))).isEmpty();
    }

    @Test
    @DisplayName("Should hand a failed load's exception to callers waiting on it")
    void testWaitersShareFailure() throws Exception {
        CountDownLatch loaderEntered = new CountDownLatch(1);
        CountDownLatch releaseLoader = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            Future<List<Entry>> failing = executor.submit(() -> cache.getOrLoad(key, () -> {
                loaderEntered.countDown();
                await(releaseLoader);
                throw new IllegalStateException("upstream down");
            }));
            assertThat(loaderEntered.await(5, TimeUnit.SECONDS)).isTrue();

            AtomicInteger waiterLoads = new AtomicInteger();
            Future<List<Entry>> waiter = executor.submit(() -> cache.getOrLoad(key, () -> {
                waiterLoads.incrementAndGet();
                return List.of();
            }));
            // The waiter has joined the in-flight load once it is counted as a hit
            while (cache.hitCount() == 0) {
                Thread.onSpinWait();
            }
            releaseLoader.countDown();

            assertThatThrownBy(() -> failing.get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> waiter.get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(IllegalStateException.class);
            assertThat(waiterLoads.get()).isZero();
            assertThat(cache.size()).isZero();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should load only once for concurrent identical requests")
    void testConcurrentSingleLoad() throws Exception {
        int threads = 8;
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch loaderEntered = new CountDownLatch(1);
        CountDownLatch releaseLoader = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        try {
            List<Future<List<Entry>>> futures = new ArrayList<>();
            futures.add(executor.submit(() -> cache.getOrLoad(key, () -> {
                loads.incrementAndGet();
                loaderEntered.countDown();
                await(releaseLoader);
                return List.of(Entry.at(START));
            })));

            assertThat(loaderEntered.await(5, TimeUnit.SECONDS)).isTrue();
            for (int i = 1; i < threads; i++) {
                futures.add(executor.submit(() -> cache.getOrLoad(key, () -> {
                    loads.incrementAndGet();
                    return List.of();
                })));
            }
            releaseLoader.countDown();

            for (Future<List<Entry>> future : futures) {
                assertThat(future.get(5, TimeUnit.SECONDS)).hasSize(1);
            }
            assertThat(loads.get()).isEqualTo(1);
            assertThat(cache.size()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should not block other keys while one key is loading")
    void testOtherKeysNotBlocked() throws Exception {
        CountDownLatch loaderEntered = new CountDownLatch(1);
        CountDownLatch releaseLoader = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            Future<List<Entry>> slow = executor.submit(() -> cache.getOrLoad(key, () -> {
                loaderEntered.countDown();
                await(releaseLoader);
                return List.of(Entry.at(START));
            }));
            assertThat(loaderEntered.await(5, TimeUnit.SECONDS)).isTrue();

            CacheKey otherKey = new CacheKey("other", START, END);
            assertThat(cache.getOrLoad(otherKey, List::of)).isEmpty();

            releaseLoader.countDown();
            assertThat(slow.get(5, TimeUnit.SECONDS)).hasSize(1);
        } finally {
            executor.shutdownNow();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
