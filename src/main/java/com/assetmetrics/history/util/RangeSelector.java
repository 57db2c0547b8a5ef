package com.assetmetrics.history.util;

import com.assetmetrics.history.domain.WindowName;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Maps lookback distances onto the upstream's fixed window ladder.
 *
 * Thread-safe and stateless - all methods are pure functions.
 */
public class RangeSelector {

    private final List<WindowName> ladder;

    public RangeSelector() {
        this(WindowName.ladder());
    }

    /**
     * @param ladder Windows ordered by ascending lookback
     */
    public RangeSelector(List<WindowName> ladder) {
        Objects.requireNonNull(ladder, "Ladder cannot be null");
        if (ladder.isEmpty()) {
            throw new IllegalArgumentException("Ladder cannot be empty");
        }
        for (int i = 1; i < ladder.size(); i++) {
            if (ladder.get(i).lookback().compareTo(ladder.get(i - 1).lookback()) < 0) {
                throw new IllegalArgumentException("Ladder must be ordered by ascending lookback");
            }
        }
        this.ladder = List.copyOf(ladder);
    }

    /**
     * Returns the narrowest window whose lookback is at least the given distance,
     * or the widest window if the distance exceeds every rung.
     *
     * @param distanceToMidnight How far the requested start lies before midnight
     * @return The window to query
     */
    public WindowName selectWindow(Duration distanceToMidnight) {
        return ladder.get(ceilingIndex(distanceToMidnight));
    }

    /**
     * Returns the next wider window, or the same window if it is already the widest.
     *
     * @param window A window on the ladder
     * @return The next rung up
     * @throws IllegalArgumentException if the window is not on the ladder
     */
    public WindowName widen(WindowName window) {
        int idx = ladder.indexOf(window);
        if (idx < 0) {
            throw new IllegalArgumentException("Window is not on the ladder: " + window);
        }
        return idx == ladder.size() - 1 ? window : ladder.get(idx + 1);
    }

    public WindowName widest() {
        return ladder.get(ladder.size() - 1);
    }

    // Binary search for the first rung with lookback >= distance
    private int ceilingIndex(Duration distance) {
        int lo = 0;
        int hi = ladder.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (ladder.get(mid).lookback().compareTo(distance) >= 0) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo == ladder.size() ? ladder.size() - 1 : lo;
    }
}
