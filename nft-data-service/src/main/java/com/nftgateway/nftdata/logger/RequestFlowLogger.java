package com.nftgateway.nftdata.logger;

import com.nftgateway.common.cache.CacheKey;
import com.nftgateway.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logs each stage of a request's trip through the orchestrator. Pure side effects.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}</li>
 *   <li>{@link #CACHE_HIT} or {@link #CACHE_MISS}</li>
 *   <li>{@link #UPSTREAM_FETCHED}</li>
 *   <li>{@link #CACHE_STORED}</li>
 * </ol>
 * {@link #REQUEST_FAILED} replaces the tail when the upstream call fails.
 */
@Component
public class RequestFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(RequestFlowLogger.class);

    public static final String REQUEST_RECEIVED = "REQUEST_RECEIVED";
    public static final String CACHE_HIT        = "CACHE_HIT";
    public static final String CACHE_MISS       = "CACHE_MISS";
    public static final String UPSTREAM_FETCHED = "UPSTREAM_FETCHED";
    public static final String CACHE_STORED     = "CACHE_STORED";
    public static final String REQUEST_FAILED   = "REQUEST_FAILED";

    public void stage(String stageName, String traceId, CacheKey key, Object detail) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[RequestFlow] stage={} key={} detail={} traceId={}", stageName, key, detail, traceId)
        );
    }

    public void failed(String traceId, String operationName, String identityParam, Throwable error) {
        TraceContextUtil.withMdc(traceId, () ->
            log.warn("[RequestFlow] stage={} operation={} identity={} error={} traceId={}",
                     REQUEST_FAILED, operationName, identityParam, error.getMessage(), traceId)
        );
    }
}
