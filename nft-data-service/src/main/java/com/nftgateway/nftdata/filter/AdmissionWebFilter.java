package com.nftgateway.nftdata.filter;

import com.nftgateway.common.admission.AdmissionDecision;
import com.nftgateway.common.admission.AdmissionLimiter;
import com.nftgateway.common.trace.TraceContextUtil;
import com.nftgateway.nftdata.config.RateLimitProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Inbound admission gate. Runs before any handler, so rejected requests never reach the
 * orchestrator, and counts every request whether or not it would be served from cache.
 *
 * <p>Limited responses carry {@code RateLimit-Limit}, {@code RateLimit-Remaining} and
 * {@code RateLimit-Reset}; rejections answer 429 with a JSON message.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class AdmissionWebFilter implements WebFilter {

    private static final Logger log = LoggerFactory.getLogger(AdmissionWebFilter.class);

    static final String REJECTION_BODY =
        "{\"error\":\"Too many requests from this IP, please try again later.\"}";

    private static final String UNKNOWN_CLIENT = "unknown";

    private final AdmissionLimiter limiter;
    private final RateLimitProperties properties;
    private final Clock clock;

    public AdmissionWebFilter(AdmissionLimiter limiter, RateLimitProperties properties, Clock clock) {
        this.limiter    = limiter;
        this.properties = properties;
        this.clock      = clock;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String path = request.getPath().pathWithinApplication().value();
        if (properties.getLimitedPaths().stream().noneMatch(path::startsWith)) {
            return chain.filter(exchange);
        }

        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);
            String client = clientIdentity(request);
            AdmissionDecision decision = limiter.tryAdmit(client);
            ServerHttpResponse response = exchange.getResponse();

            if (decision.isLimited()) {
                HttpHeaders headers = response.getHeaders();
                headers.set("RateLimit-Limit", String.valueOf(decision.limit()));
                headers.set("RateLimit-Remaining", String.valueOf(decision.remaining()));
                headers.set("RateLimit-Reset", String.valueOf(decision.secondsUntilReset(clock.instant())));
            }

            if (!decision.admitted()) {
                TraceContextUtil.withMdc(traceId, () ->
                    log.warn("ADMISSION_REJECTED client={} method={} path={} limit={} traceId={}",
                             client, request.getMethod(), path, decision.limit(), traceId));
                return reject(response);
            }

            TraceContextUtil.withMdc(traceId, () ->
                log.debug("ADMITTED client={} method={} path={} remaining={} traceId={}",
                          client, request.getMethod(), path, decision.remaining(), traceId));
            return chain.filter(exchange);
        });
    }

    String clientIdentity(ServerHttpRequest request) {
        for (String header : properties.getTrustedHeaders()) {
            String value = request.getHeaders().getFirst(header);
            if (value != null && !value.isBlank()) {
                String firstHop = value.split(",")[0].trim();
                if (!firstHop.isEmpty()) {
                    return firstHop;
                }
            }
        }
        InetSocketAddress remote = request.getRemoteAddress();
        if (remote != null && remote.getAddress() != null) {
            return remote.getAddress().getHostAddress();
        }
        return UNKNOWN_CLIENT;
    }

    private static Mono<Void> reject(ServerHttpResponse response) {
        response.setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        DataBuffer body = response.bufferFactory().wrap(REJECTION_BODY.getBytes(StandardCharsets.UTF_8));
        return response.writeWith(Mono.just(body));
    }
}
