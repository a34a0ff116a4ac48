package com.nftgateway.common.retry;

import com.nftgateway.common.error.ErrorClassifier;
import com.nftgateway.common.error.UpstreamErrorType;
import com.nftgateway.common.error.UpstreamFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Sequential retry loop for a fallible reactive operation.
 *
 * <p>The operation is re-subscribed only when the classifier reports
 * {@link UpstreamErrorType#RATE_LIMITED} and fewer than {@link RetryPolicy#maxRetries()}
 * attempts have run. Waits are {@code Mono.delay} timers, so no thread is held while backing
 * off. Any other classification, or exhaustion, terminates with an
 * {@link UpstreamFailureException} wrapping the last error.
 *
 * <p>One loop per call: concurrent identical calls are not coalesced.
 */
public class BackoffRetrier {

    private static final Logger log = LoggerFactory.getLogger(BackoffRetrier.class);

    private final RetryPolicy policy;
    private final LongSupplier jitterMillis;

    public BackoffRetrier(RetryPolicy policy) {
        this(policy, randomJitter(policy.maxJitter()));
    }

    public BackoffRetrier(RetryPolicy policy, LongSupplier jitterMillis) {
        this.policy       = policy;
        this.jitterMillis = jitterMillis;
    }

    public RetryPolicy policy() {
        return policy;
    }

    public <T> Mono<T> execute(Supplier<Mono<T>> operation, ErrorClassifier classifier) {
        return attempt(operation, classifier, 1);
    }

    private <T> Mono<T> attempt(Supplier<Mono<T>> operation, ErrorClassifier classifier, int attempt) {
        return Mono.defer(operation)
            .onErrorResume(error -> {
                UpstreamErrorType type = classifier.classify(error);
                if (type != UpstreamErrorType.RATE_LIMITED || attempt >= policy.maxRetries()) {
                    log.debug("Upstream call failed, not retrying. type={} attempt={}/{} error={}",
                              type, attempt, policy.maxRetries(), error.getMessage());
                    return Mono.error(new UpstreamFailureException(type, attempt, error));
                }
                Duration delay = policy.delayFor(attempt, jitterMillis.getAsLong());
                log.info("Rate limited, retrying in {}ms (attempt {}/{})",
                         delay.toMillis(), attempt, policy.maxRetries());
                return Mono.delay(delay)
                    .then(Mono.defer(() -> attempt(operation, classifier, attempt + 1)));
            });
    }

    private static LongSupplier randomJitter(Duration maxJitter) {
        long bound = maxJitter.toMillis();
        return () -> bound <= 0 ? 0L : ThreadLocalRandom.current().nextLong(bound);
    }
}
