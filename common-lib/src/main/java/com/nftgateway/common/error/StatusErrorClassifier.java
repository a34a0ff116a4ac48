package com.nftgateway.common.error;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Default {@link ErrorClassifier} keyed on HTTP-style status codes.
 *
 * <ul>
 *   <li>status 429, or a message mentioning {@code 429} → {@link UpstreamErrorType#RATE_LIMITED}</li>
 *   <li>status 5xx, timeouts and I/O failures anywhere in the cause chain → {@link UpstreamErrorType#TRANSIENT}</li>
 *   <li>anything else → {@link UpstreamErrorType#FATAL}</li>
 * </ul>
 *
 * <p>The message check covers SDK errors that only carry the status in their text.
 */
public class StatusErrorClassifier implements ErrorClassifier {

    public static final int TOO_MANY_REQUESTS = 429;

    @Override
    public UpstreamErrorType classify(Throwable error) {
        if (error instanceof UpstreamStatusException statusError) {
            int status = statusError.getStatus();
            if (status == TOO_MANY_REQUESTS) return UpstreamErrorType.RATE_LIMITED;
            if (status >= 500) return UpstreamErrorType.TRANSIENT;
        }
        String message = error.getMessage();
        if (message != null && message.contains(String.valueOf(TOO_MANY_REQUESTS))) {
            return UpstreamErrorType.RATE_LIMITED;
        }
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof IOException) {
                return UpstreamErrorType.TRANSIENT;
            }
            if (t.getCause() == t) break;
        }
        return UpstreamErrorType.FATAL;
    }
}
