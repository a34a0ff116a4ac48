package com.nftgateway.common.cache;

import java.util.Locale;

/**
 * Deterministic cache key for one logical paged request.
 *
 * <p>Layout: {@code <namespace>:<operation>:<identity>:<cursor|first>:<pageSize>}.
 * The identity is trimmed and lower-cased so that {@code 0xABC} and {@code 0xabc}
 * resolve to the same entry; an absent or blank cursor maps to the sentinel
 * {@value #FIRST_PAGE}.
 */
public record CacheKey(String value) {

    public static final String FIRST_PAGE = "first";

    public static CacheKey of(String namespace, String operationName, String identityParam,
                              String cursor, int pageSize) {
        String identity = identityParam == null ? "" : identityParam.trim().toLowerCase(Locale.ROOT);
        String page     = cursor == null || cursor.isBlank() ? FIRST_PAGE : cursor;
        return new CacheKey(namespace + ":" + operationName + ":" + identity + ":" + page + ":" + pageSize);
    }

    @Override
    public String toString() {
        return value;
    }
}
