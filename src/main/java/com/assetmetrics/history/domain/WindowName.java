package com.assetmetrics.history.domain;

import java.time.Duration;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Relative lookback windows understood by the upstream {@code time_range} parameter.
 * Ladder windows end at the upstream's midnight and reach back their duration;
 * {@link #TODAY} covers upstream midnight until now and sits outside the ladder.
 */
public enum WindowName {

    YESTERDAY("yesterday", Duration.ofHours(24)),
    LAST_2_DAYS("last_2_days", Duration.ofHours(48)),
    LAST_7_DAYS("last_7_days", Duration.ofHours(168)),
    LAST_14_DAYS("last_14_days", Duration.ofHours(336)),
    LAST_31_DAYS("last_31_days", Duration.ofHours(744)),
    TODAY("today", Duration.ZERO);

    private static final List<WindowName> LADDER = Arrays.stream(values())
        .filter(WindowName::isLadderRung)
        .sorted(Comparator.comparing(WindowName::lookback))
        .toList();

    private final String wireName;
    private final Duration lookback;

    WindowName(String wireName, Duration lookback) {
        this.wireName = wireName;
        this.lookback = lookback;
    }

    /** Value sent as the upstream {@code time_range} query parameter. */
    public String wireName() {
        return wireName;
    }

    /** How far before upstream midnight the window reaches. Zero for {@link #TODAY}. */
    public Duration lookback() {
        return lookback;
    }

    public boolean isLadderRung() {
        return this != TODAY;
    }

    /** Ladder rungs ordered by ascending lookback. */
    public static List<WindowName> ladder() {
        return LADDER;
    }

    /**
     * Parses an upstream wire name such as {@code "last_7_days"}.
     *
     * @throws IllegalArgumentException if the name is not a known window
     */
    public static WindowName fromWireName(String wireName) {
        for (WindowName window : values()) {
            if (window.wireName.equals(wireName)) {
                return window;
            }
        }
        throw new IllegalArgumentException("Unknown time range: " + wireName);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
