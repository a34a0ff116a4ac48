package com.nftgateway.nftdata.filter;

import com.nftgateway.common.trace.TraceContextUtil;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Assigns every request a trace id (inbound {@code X-Trace-Id} or a fresh UUID), echoes it
 * on the response and stores it in the Reactor Context for the rest of the chain.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdWebFilter implements WebFilter {

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String inbound = exchange.getRequest().getHeaders().getFirst(TraceContextUtil.TRACE_HEADER);
        String traceId = inbound != null && !inbound.isBlank() ? inbound : TraceContextUtil.newTraceId();
        exchange.getResponse().getHeaders().set(TraceContextUtil.TRACE_HEADER, traceId);
        return TraceContextUtil.withTraceId(chain.filter(exchange), traceId);
    }
}
