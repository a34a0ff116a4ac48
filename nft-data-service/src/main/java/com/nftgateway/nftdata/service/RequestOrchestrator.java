package com.nftgateway.nftdata.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nftgateway.common.cache.CacheAccessGuard;
import com.nftgateway.common.cache.CacheKey;
import com.nftgateway.common.cache.CacheLookup;
import com.nftgateway.common.error.ErrorClassifier;
import com.nftgateway.common.error.UpstreamFailureException;
import com.nftgateway.common.retry.BackoffRetrier;
import com.nftgateway.common.trace.TraceContextUtil;
import com.nftgateway.nftdata.logger.RequestFlowLogger;
import com.nftgateway.nftdata.model.ErrorPayload;
import com.nftgateway.nftdata.model.OperationResponse;
import com.nftgateway.nftdata.model.PagedResult;
import com.nftgateway.nftdata.model.Pagination;
import com.nftgateway.nftdata.operation.OperationRegistry;
import com.nftgateway.nftdata.operation.PagedOperation;
import com.nftgateway.nftdata.operation.UpstreamPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * Cache-first request pipeline for every {@link PagedOperation}.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Derive the {@link CacheKey} from operation, identity, cursor and page size.</li>
 *   <li>Consult {@link CacheAccessGuard}; a hit is deserialised and returned without any
 *       upstream call.</li>
 *   <li>On miss, fetch through {@link BackoffRetrier}, shape the {@link PagedResult}, store it
 *       with the operation's TTL, return it.</li>
 *   <li>On terminal upstream failure, return an {@link ErrorPayload}.</li>
 * </ol>
 *
 * <p>The returned {@code Mono} never signals an error: every exit is a payload. Steps run
 * strictly in sequence within a request; concurrent misses on the same key each fetch.
 */
@Service
public class RequestOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RequestOrchestrator.class);

    public static final int DEFAULT_PAGE_SIZE = 100;

    private final OperationRegistry registry;
    private final CacheAccessGuard cacheGuard;
    private final BackoffRetrier retrier;
    private final ErrorClassifier errorClassifier;
    private final ObjectMapper objectMapper;
    private final RequestFlowLogger flowLogger;
    private final Clock clock;
    private final String keyNamespace;
    private final Duration defaultTtl;

    public RequestOrchestrator(
            OperationRegistry registry,
            CacheAccessGuard cacheGuard,
            BackoffRetrier retrier,
            ErrorClassifier errorClassifier,
            ObjectMapper objectMapper,
            RequestFlowLogger flowLogger,
            Clock clock,
            @Value("${cache.key-prefix:mcp}") String keyPrefix,
            @Value("${upstream.chain-id:360}") int chainId,
            @Value("${cache.default-ttl:60s}") Duration defaultTtl) {
        this.registry        = registry;
        this.cacheGuard      = cacheGuard;
        this.retrier         = retrier;
        this.errorClassifier = errorClassifier;
        this.objectMapper    = objectMapper;
        this.flowLogger      = flowLogger;
        this.clock           = clock;
        this.keyNamespace    = keyPrefix + ":" + chainId;
        this.defaultTtl      = defaultTtl;
    }

    public Mono<OperationResponse> handle(String operationName, String identityParam,
                                          String paginationCursor, Integer pageSize) {
        int size = pageSize != null ? pageSize : DEFAULT_PAGE_SIZE;

        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);

            PagedOperation operation = registry.find(operationName).orElse(null);
            if (operation == null) {
                log.warn("Unknown operation requested. operation={} traceId={}", operationName, traceId);
                return Mono.just(errorPayload("Unknown operation: " + operationName, identityParam));
            }

            CacheKey key = CacheKey.of(keyNamespace, operation.name(), identityParam, paginationCursor, size);
            flowLogger.stage(RequestFlowLogger.REQUEST_RECEIVED, traceId, key, operation.name());

            return cacheGuard.get(key)
                .flatMap(lookup -> readCached(lookup, key, traceId))
                .switchIfEmpty(Mono.defer(() ->
                    fetchAndStore(operation, key, identityParam, paginationCursor, size, traceId)))
                .onErrorResume(error -> {
                    flowLogger.failed(traceId, operation.name(), identityParam, error);
                    return Mono.just(toErrorPayload(error, identityParam));
                });
        });
    }

    // ── cache path ────────────────────────────────────────────────────────────

    /** Emits the cached page, or nothing when the lookup missed or the entry is unreadable. */
    private Mono<OperationResponse> readCached(CacheLookup lookup, CacheKey key, String traceId) {
        if (!lookup.isHit()) {
            flowLogger.stage(RequestFlowLogger.CACHE_MISS, traceId, key, lookup.status());
            return Mono.empty();
        }
        try {
            PagedResult cached = objectMapper.readValue(lookup.value(), PagedResult.class);
            if (!isComplete(cached)) {
                log.warn("Incomplete cache entry, treating as miss. key={}", key);
                return Mono.empty();
            }
            flowLogger.stage(RequestFlowLogger.CACHE_HIT, traceId, key, cached.pagination().totalReturned());
            return Mono.just(cached);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable cache entry, treating as miss. key={} error={}", key, e.getOriginalMessage());
            return Mono.empty();
        }
    }

    private static boolean isComplete(PagedResult cached) {
        return cached != null && cached.items() != null && cached.pagination() != null;
    }

    // ── upstream path ─────────────────────────────────────────────────────────

    private Mono<OperationResponse> fetchAndStore(PagedOperation operation, CacheKey key, String identityParam,
                                                  String cursor, int pageSize, String traceId) {
        String upstreamCursor = cursor == null || cursor.isBlank() ? null : cursor;
        return retrier.execute(() -> operation.fetchPage(identityParam, upstreamCursor, pageSize), errorClassifier)
            .map(page -> toResult(page, pageSize))
            .doOnNext(result -> flowLogger.stage(RequestFlowLogger.UPSTREAM_FETCHED, traceId, key,
                                                 result.pagination().totalReturned()))
            .flatMap(result -> store(key, result, operation.cacheTtl().orElse(defaultTtl), traceId)
                .<OperationResponse>thenReturn(result));
    }

    private Mono<Void> store(CacheKey key, PagedResult result, Duration ttl, String traceId) {
        String json;
        try {
            json = objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.warn("Result not serialisable, skipping cache write. key={} error={}", key, e.getOriginalMessage());
            return Mono.empty();
        }
        return cacheGuard.set(key, json, ttl)
            .doOnNext(status -> flowLogger.stage(RequestFlowLogger.CACHE_STORED, traceId, key, status))
            .then();
    }

    private static PagedResult toResult(UpstreamPage page, int pageSize) {
        int returned = page.items().size();
        Pagination pagination = new Pagination(pageSize, page.nextCursor() != null, page.nextCursor(), returned);
        int totalCount = page.totalCount() != null && page.totalCount() > 0 ? page.totalCount() : returned;
        return new PagedResult(page.items(), pagination, totalCount, page.summary());
    }

    // ── failure path ──────────────────────────────────────────────────────────

    private ErrorPayload toErrorPayload(Throwable error, String identityParam) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        if (error instanceof UpstreamFailureException failure && failure.isRateLimited()) {
            return errorPayload("Rate limited by upstream API. Please try again in a few moments. "
                                + "Original error: " + message, identityParam);
        }
        return errorPayload("Error fetching data: " + message, identityParam);
    }

    private ErrorPayload errorPayload(String message, String identityParam) {
        return ErrorPayload.of(message, identityParam, clock.instant());
    }
}
