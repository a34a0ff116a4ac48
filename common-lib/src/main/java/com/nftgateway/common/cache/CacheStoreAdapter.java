package com.nftgateway.common.cache;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Minimal key/value store with per-entry expiry, backing the {@link CacheAccessGuard}.
 *
 * <p>Implementations must be lazy: no I/O may happen before subscription, and cancelling
 * the returned {@code Mono} must abandon the in-flight command. The guard relies on this
 * to bound every call with a deadline.
 */
public interface CacheStoreAdapter {

    /**
     * @return the stored value, or an empty {@code Mono} when the key is absent or expired
     */
    Mono<String> get(String key);

    /**
     * Stores {@code value} under {@code key}, expiring after {@code ttl}.
     *
     * @return {@code true} once the store acknowledged the write
     */
    Mono<Boolean> setWithExpiry(String key, String value, Duration ttl);
}
