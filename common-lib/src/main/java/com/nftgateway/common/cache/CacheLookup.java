package com.nftgateway.common.cache;

import java.util.Optional;

/**
 * Result of {@link CacheAccessGuard#get(CacheKey)}: either a hit carrying the stored value,
 * or an absence carrying the reason.
 */
public record CacheLookup(String value, CacheStatus status) {

    public static CacheLookup hit(String value) {
        return new CacheLookup(value, CacheStatus.HIT);
    }

    public static CacheLookup absent(CacheStatus reason) {
        return new CacheLookup(null, reason);
    }

    public boolean isHit() {
        return status == CacheStatus.HIT;
    }

    public Optional<String> valueIfPresent() {
        return Optional.ofNullable(value);
    }
}
