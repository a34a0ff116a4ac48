package com.nftgateway.common.error;

/**
 * Terminal upstream failure surfaced by {@link com.nftgateway.common.retry.BackoffRetrier}
 * once an error is not retryable or retries are exhausted.
 *
 * <p>The message is the underlying error's message so callers can report it verbatim.
 */
public class UpstreamFailureException extends RuntimeException {

    private final UpstreamErrorType errorType;
    private final int attempts;

    public UpstreamFailureException(UpstreamErrorType errorType, int attempts, Throwable cause) {
        super(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(), cause);
        this.errorType = errorType;
        this.attempts  = attempts;
    }

    public UpstreamErrorType getErrorType() {
        return errorType;
    }

    public int getAttempts() {
        return attempts;
    }

    public boolean isRateLimited() {
        return errorType == UpstreamErrorType.RATE_LIMITED;
    }
}
