package com.nftgateway.common.error;

/**
 * Raised by upstream clients when the remote side answers with a non-success status.
 */
public class UpstreamStatusException extends RuntimeException {

    private final int status;

    public UpstreamStatusException(int status, String message) {
        super("Upstream responded " + status + ": " + message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
