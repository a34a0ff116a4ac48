package com.nftgateway.common.admission;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fixed-window request counter per client identity.
 *
 * <p>Each request increments the identity's counter; requests are admitted while
 * {@code count <= max} and rejected afterwards until the window ends. A window is reset
 * lazily by the first request that arrives once {@code now - windowStart >= window};
 * there is no background timer. At most once per window length, a request also sweeps out
 * every elapsed window, so identities that never return do not accumulate.
 *
 * <p>Updates go through {@link ConcurrentHashMap#compute}, which is atomic per key, so
 * concurrent bursts from one identity are never undercounted. Different identities never
 * share state.
 */
public class FixedWindowAdmissionLimiter implements AdmissionLimiter {

    private static final Logger log = LoggerFactory.getLogger(FixedWindowAdmissionLimiter.class);

    private final int max;
    private final Duration window;
    private final Clock clock;

    private final ConcurrentHashMap<String, RateWindow> windows = new ConcurrentHashMap<>();
    private final AtomicReference<Instant> nextSweep;

    public FixedWindowAdmissionLimiter(int max, Duration window, Clock clock) {
        if (max < 0) {
            throw new IllegalArgumentException("max must be >= 0, was " + max);
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive, was " + window);
        }
        this.max    = max;
        this.window = window;
        this.clock  = clock;
        this.nextSweep = new AtomicReference<>(clock.instant().plus(window));
    }

    @Override
    public AdmissionDecision tryAdmit(String clientIdentity) {
        Instant now = clock.instant();
        RateWindow current = windows.compute(clientIdentity, (id, existing) ->
            existing == null || existing.hasElapsed(now, window)
                ? RateWindow.open(now)
                : existing.increment());
        sweepIfDue(now);

        boolean admitted = current.count() <= max;
        int remaining = Math.max(0, max - current.count());
        if (!admitted) {
            log.debug("ADMISSION_REJECTED identity={} count={} max={}", clientIdentity, current.count(), max);
        }
        return new AdmissionDecision(admitted, max, remaining, current.resetAt(window));
    }

    @Override
    public void reset(String clientIdentity) {
        windows.remove(clientIdentity);
    }

    private void sweepIfDue(Instant now) {
        Instant due = nextSweep.get();
        if (now.isBefore(due) || !nextSweep.compareAndSet(due, now.plus(window))) {
            return;
        }
        int before = windows.size();
        // conditional per entry: a window renewed concurrently is kept
        windows.values().removeIf(w -> w.hasElapsed(now, window));
        log.debug("Swept elapsed admission windows. before={} after={}", before, windows.size());
    }

    int trackedIdentities() {
        return windows.size();
    }
}
