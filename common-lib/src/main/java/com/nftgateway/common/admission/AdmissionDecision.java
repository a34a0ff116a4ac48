package com.nftgateway.common.admission;

import java.time.Duration;
import java.time.Instant;

/**
 * Verdict for one inbound request.
 *
 * @param admitted  whether the request may proceed
 * @param limit     configured maximum per window, or {@code -1} when limiting is disabled
 * @param remaining requests still admissible in the current window
 * @param resetAt   end of the current window, or {@code null} when limiting is disabled
 */
public record AdmissionDecision(boolean admitted, int limit, int remaining, Instant resetAt) {

    public static AdmissionDecision unlimited() {
        return new AdmissionDecision(true, -1, -1, null);
    }

    public boolean isLimited() {
        return limit >= 0;
    }

    /** Whole seconds until the window resets, never negative. */
    public long secondsUntilReset(Instant now) {
        if (resetAt == null) return 0;
        long millis = Duration.between(now, resetAt).toMillis();
        return Math.max(0, (millis + 999) / 1000);
    }
}
