package com.nftgateway.common.error;

/**
 * Classification of an upstream failure. Only {@link #RATE_LIMITED} is retried.
 */
public enum UpstreamErrorType {
    RATE_LIMITED,
    TRANSIENT,
    FATAL
}
