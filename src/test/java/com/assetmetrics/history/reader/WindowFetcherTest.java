package com.assetmetrics.history.reader;

import com.assetmetrics.history.domain.Entry;
import com.assetmetrics.history.domain.Page;
import com.assetmetrics.history.domain.WindowName;
import com.assetmetrics.history.upstream.UpstreamClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link WindowFetcher} - paging and trimming of one upstream window.
 *
 * <p><b>Test Strategy:</b>
 * <ul>
 *   <li>Mock the upstream client and hand out pages explicitly</li>
 *   <li>Use a real SkewGuard so day changes abort the fetch</li>
 *   <li>Include unsorted pages: the trim must never leak out-of-range samples</li>
 * </ul>
 */
@DisplayName("WindowFetcher Tests")
class WindowFetcherTest {

    private static final String ASSET_ID = "arn:aws:ec2:us-east-1:12345:instance/i-12345678";
    private static final LocalDate DAY = LocalDate.of(2017, 6, 20);

    private UpstreamClient upstream;
    private WindowFetcher fetcher;

    @BeforeEach
    void setUp() {
        upstream = mock(UpstreamClient.class);
        fetcher = new WindowFetcher(upstream, "https://upstream.test/metrics/v1", "key");
    }

    private static Instant at(String time) {
        return Instant.parse("2017-06-20T" + time + ":00Z");
    }

    private static List<Entry> entries(String... times) {
        return Arrays.stream(times).map(t -> Entry.at(at(t))).toList();
    }

    @Test
    @DisplayName("Should trim a single page to [start, end) and report both edges covered")
    void testSinglePageCoversBoth() {
        when(upstream.fetch(anyString()))
            .thenReturn(Page.last(entries("00:00", "01:00", "02:00", "03:00", "04:00"), DAY));

        WindowFetch result = fetcher.fetch(
            ASSET_ID, WindowName.TODAY, at("01:00"), at("03:00"), new SkewGuard(), false);

        assertThat(result.entries()).extracting(Entry::time).containsExactly(at("01:00"), at("02:00"));
        assertThat(result.coversLeft()).isTrue();
        assertThat(result.coversRight()).isTrue();
        assertThat(result.outcome()).isEqualTo(FetchOutcome.COVERED_BOTH);
        verify(upstream, times(1)).fetch(anyString());
    }

    /**
     * <b>Given:</b> A first page that starts after the requested start
     * <p><b>When:</b> Fetching with exitEarly
     * <p><b>Then:</b> The first page is trimmed and returned, and no further page is read
     */
    @Test
    @DisplayName("Should stop after the first page when it starts too late and exitEarly is set")
    void testExitEarly() {
        when(upstream.fetch(anyString()))
            .thenReturn(new Page(entries("02:00", "03:00"), "https://upstream.test/next", DAY));

        WindowFetch result = fetcher.fetch(
            ASSET_ID, WindowName.YESTERDAY, at("01:00"), at("05:00"), new SkewGuard(), true);

        assertThat(result.coversLeft()).isFalse();
        assertThat(result.coversRight()).isFalse();
        assertThat(result.outcome()).isEqualTo(FetchOutcome.NEEDS_WIDER);
        assertThat(result.entries()).extracting(Entry::time).containsExactly(at("02:00"), at("03:00"));
        verify(upstream, times(1)).fetch(anyString());
    }

    @Test
    @DisplayName("Should keep paging when the first page starts too late without exitEarly")
    void testNoExitEarlyKeepsPaging() {
        when(upstream.fetch(anyString()))
            .thenReturn(new Page(entries("02:00", "03:00"), "https://upstream.test/next", DAY))
            .thenReturn(Page.last(entries("04:00", "05:00"), DAY));

        WindowFetch result = fetcher.fetch(
            ASSET_ID, WindowName.YESTERDAY, at("01:00"), at("05:00"), new SkewGuard(), false);

        assertThat(result.coversLeft()).isFalse();
        assertThat(result.coversRight()).isTrue();
        assertThat(result.entries()).extracting(Entry::time)
            .containsExactly(at("02:00"), at("03:00"), at("04:00"));
        verify(upstream).fetch("https://upstream.test/next");
    }

    @Test
    @DisplayName("Should follow next links until a sample at or after end is seen")
    void testPagination() {
        when(upstream.fetch(anyString()))
            .thenReturn(new Page(entries("00:00", "01:00"), "https://upstream.test/page2", DAY))
            .thenReturn(new Page(entries("02:00", "03:00"), "https://upstream.test/page3", DAY))
            .thenReturn(Page.last(entries("04:00"), DAY));

        WindowFetch result = fetcher.fetch(
            ASSET_ID, WindowName.LAST_2_DAYS, at("01:00"), at("03:00"), new SkewGuard(), false);

        assertThat(result.entries()).extracting(Entry::time).containsExactly(at("01:00"), at("02:00"));
        assertThat(result.coversRight()).isTrue();
        // Page 3 is never requested
        verify(upstream, times(2)).fetch(anyString());
    }

    @Test
    @DisplayName("Should report the right edge uncovered when pages run out before end")
    void testRightEdgeNotCovered() {
        when(upstream.fetch(anyString()))
            .thenReturn(Page.last(entries("00:00", "01:00", "02:00"), DAY));

        WindowFetch result = fetcher.fetch(
            ASSET_ID, WindowName.YESTERDAY, at("01:00"), at("05:00"), new SkewGuard(), true);

        assertThat(result.coversLeft()).isTrue();
        assertThat(result.coversRight()).isFalse();
        assertThat(result.outcome()).isEqualTo(FetchOutcome.NEEDS_SUPPLEMENT);
        assertThat(result.entries()).hasSize(2);
    }

    @Test
    @DisplayName("Should report neither edge covered for an empty page")
    void testEmptyPage() {
        when(upstream.fetch(anyString())).thenReturn(Page.last(List.of(), DAY));

        WindowFetch result = fetcher.fetch(
            ASSET_ID, WindowName.TODAY, at("01:00"), at("05:00"), new SkewGuard(), false);

        assertThat(result.entries()).isEmpty();
        assertThat(result.coversLeft()).isFalse();
        assertThat(result.coversRight()).isFalse();
    }

    @Test
    @DisplayName("Should never return out-of-range samples from an unsorted page")
    void testUnsortedPage() {
        when(upstream.fetch(anyString()))
            .thenReturn(Page.last(entries("00:00", "02:00", "00:30", "01:00", "06:00", "03:00"), DAY));

        WindowFetch result = fetcher.fetch(
            ASSET_ID, WindowName.TODAY, at("01:00"), at("05:00"), new SkewGuard(), false);

        assertThat(result.entries()).allSatisfy(e -> assertThat(e.isWithin(at("01:00"), at("05:00"))).isTrue());
        assertThat(result.entries()).extracting(Entry::time).containsExactly(at("02:00"), at("01:00"));
        assertThat(result.coversRight()).isTrue();
    }

    @Test
    @DisplayName("Should abort when the upstream day changes between pages")
    void testDayChangeBetweenPages() {
        when(upstream.fetch(anyString()))
            .thenReturn(new Page(entries("00:00", "01:00"), "https://upstream.test/page2", DAY))
            .thenReturn(Page.last(entries("02:00", "03:00"), DAY.plusDays(1)));

        SkewGuard guard = new SkewGuard();

        assertThatThrownBy(() -> fetcher.fetch(
                ASSET_ID, WindowName.LAST_2_DAYS, at("00:00"), at("05:00"), guard, false))
            .isInstanceOf(DayRolloverException.class);
        assertThat(guard.lastDay()).isEqualTo(DAY.plusDays(1));
    }

    @Test
    @DisplayName("Should build the first page URL with encoded asset id")
    void testBuildUrl() {
        String url = fetcher.buildUrl(ASSET_ID, WindowName.LAST_7_DAYS);

        assertThat(url).startsWith("https://upstream.test/metrics/v1?");
        assertThat(url).contains("api_key=key");
        assertThat(url).contains("time_range=last_7_days");
        assertThat(url).contains("asset=arn%3Aaws%3Aec2%3Aus-east-1%3A12345%3Ainstance%2Fi-12345678");
        assertThat(url).doesNotContain("page=");
    }

    @Test
    @DisplayName("findSpan should stop at the first sample at or after end")
    void testFindSpan() {
        WindowFetcher.Span span = WindowFetcher.findSpan(
            entries("00:00", "01:00", "02:00", "03:00"), at("01:00"), at("03:00"));

        assertThat(span.startIdx()).isEqualTo(1);
        assertThat(span.endIdx()).isEqualTo(3);
    }
}
