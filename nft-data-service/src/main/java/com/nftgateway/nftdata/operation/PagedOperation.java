package com.nftgateway.nftdata.operation;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;

/**
 * A cacheable, paginated upstream read exposed by name.
 *
 * <p>Implementations are Spring beans collected by {@link OperationRegistry}. They only
 * describe the upstream call; caching, retrying and error shaping belong to
 * {@link com.nftgateway.nftdata.service.RequestOrchestrator}.
 */
public interface PagedOperation {

    String name();

    /**
     * TTL for cached pages of this operation; empty falls back to {@code cache.default-ttl}.
     */
    default Optional<Duration> cacheTtl() {
        return Optional.empty();
    }

    /**
     * @param cursor {@code null} for the first page
     */
    Mono<UpstreamPage> fetchPage(String identityParam, String cursor, int pageSize);
}
