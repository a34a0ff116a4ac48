package com.nftgateway.common.admission;

import java.time.Duration;
import java.time.Instant;

/**
 * Request count for one client identity inside the window opened at {@code windowStart}.
 */
public record RateWindow(int count, Instant windowStart) {

    public static RateWindow open(Instant now) {
        return new RateWindow(1, now);
    }

    public RateWindow increment() {
        return new RateWindow(count + 1, windowStart);
    }

    public boolean hasElapsed(Instant now, Duration window) {
        return !now.isBefore(windowStart.plus(window));
    }

    public Instant resetAt(Duration window) {
        return windowStart.plus(window);
    }
}
