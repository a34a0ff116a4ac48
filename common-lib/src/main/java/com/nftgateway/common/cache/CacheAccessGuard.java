package com.nftgateway.common.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Bounded-latency, fail-open front for a {@link CacheStoreAdapter}.
 *
 * <p>Every call completes within {@code operationTimeout}. On expiry the subscription to the
 * adapter is cancelled (no detached timer keeps the command alive) and the call resolves as
 * {@link CacheStatus#TIMEOUT}. Adapter errors resolve as {@link CacheStatus#UNAVAILABLE}.
 * Neither {@link #get} nor {@link #set} ever emits an error signal: caching is an
 * optimisation, and every store failure degrades to direct-upstream behaviour.
 *
 * <p>A guard built with {@link #disabled()} answers {@link CacheStatus#DISABLED} immediately
 * without touching any store.
 */
public class CacheAccessGuard {

    private static final Logger log = LoggerFactory.getLogger(CacheAccessGuard.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(3000);

    private final CacheStoreAdapter adapter;
    private final Duration operationTimeout;

    public CacheAccessGuard(CacheStoreAdapter adapter, Duration operationTimeout) {
        this.adapter          = adapter;
        this.operationTimeout = operationTimeout;
    }

    public static CacheAccessGuard disabled() {
        return new CacheAccessGuard(null, DEFAULT_TIMEOUT);
    }

    public boolean isEnabled() {
        return adapter != null;
    }

    public Mono<CacheLookup> get(CacheKey key) {
        if (adapter == null) {
            return Mono.just(CacheLookup.absent(CacheStatus.DISABLED));
        }
        return Mono.defer(() -> adapter.get(key.value()))
            .timeout(operationTimeout)
            .map(CacheLookup::hit)
            .defaultIfEmpty(CacheLookup.absent(CacheStatus.MISS))
            .onErrorResume(e -> {
                CacheStatus reason = reasonFor(e);
                log.warn("Cache get failed, continuing without cache. key={} reason={} error={}",
                         key, reason, e.getMessage());
                return Mono.just(CacheLookup.absent(reason));
            });
    }

    public Mono<CacheStatus> set(CacheKey key, String value, Duration ttl) {
        if (adapter == null) {
            return Mono.just(CacheStatus.DISABLED);
        }
        return Mono.defer(() -> adapter.setWithExpiry(key.value(), value, ttl))
            .timeout(operationTimeout)
            .map(ack -> Boolean.TRUE.equals(ack) ? CacheStatus.STORED : CacheStatus.UNAVAILABLE)
            .defaultIfEmpty(CacheStatus.UNAVAILABLE)
            .onErrorResume(e -> {
                CacheStatus reason = reasonFor(e);
                log.warn("Cache set failed, continuing without caching. key={} reason={} error={}",
                         key, reason, e.getMessage());
                return Mono.just(reason);
            });
    }

    private static CacheStatus reasonFor(Throwable e) {
        return e instanceof TimeoutException ? CacheStatus.TIMEOUT : CacheStatus.UNAVAILABLE;
    }
}
