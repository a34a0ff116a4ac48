package com.nftgateway.common.cache;

/**
 * Outcome of a single guarded cache operation.
 */
public enum CacheStatus {
    HIT,
    MISS,
    STORED,
    /** No store adapter configured. */
    DISABLED,
    /** The operation did not finish within the guard's deadline and was cancelled. */
    TIMEOUT,
    /** The store adapter signalled an error. */
    UNAVAILABLE
}
