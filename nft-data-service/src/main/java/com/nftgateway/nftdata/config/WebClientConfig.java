package com.nftgateway.nftdata.config;

import com.nftgateway.common.error.UpstreamStatusException;
import com.nftgateway.nftdata.client.AlchemyNftWebClient;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide upstream client. Built once at startup and shared by every request.
 */
@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    static final int SHAPE_MAINNET_CHAIN_ID = 360;

    private static final int MAX_ERROR_BODY_CHARS = 300;

    @Value("${upstream.api-key:}")
    private String apiKey;

    @Value("${upstream.chain-id:360}")
    private int chainId;

    /** Overrides the network-derived host, e.g. for a local stub. */
    @Value("${upstream.base-url:}")
    private String baseUrlOverride;

    @Bean
    public WebClient alchemyWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(15))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(15, TimeUnit.SECONDS))
            );

        return builder
            .baseUrl(resolveBaseUrl())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(statusFilter())
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public AlchemyNftWebClient alchemyNftWebClient(WebClient alchemyWebClient) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("upstream.api-key is not set; upstream calls will be rejected");
        }
        return new AlchemyNftWebClient(alchemyWebClient, apiKey);
    }

    String resolveBaseUrl() {
        if (baseUrlOverride != null && !baseUrlOverride.isBlank()) {
            return baseUrlOverride;
        }
        String network = chainId == SHAPE_MAINNET_CHAIN_ID ? "shape-mainnet" : "shape-sepolia";
        return "https://" + network + ".g.alchemy.com";
    }

    /** Turns every non-2xx answer into an {@link UpstreamStatusException} carrying the status. */
    public static ExchangeFilterFunction statusFilter() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (!clientResponse.statusCode().isError()) {
                return Mono.just(clientResponse);
            }
            int status = clientResponse.statusCode().value();
            return clientResponse.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> Mono.error(new UpstreamStatusException(status, abbreviate(body))));
        });
    }

    private static ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String sanitized = clientRequest.url().toString().replaceAll("/v3/[^/]+/", "/v3/***/");
            log.debug("Outbound request: {} {}", clientRequest.method(), sanitized);
            return Mono.just(clientRequest);
        });
    }

    private static String abbreviate(String body) {
        return body.length() <= MAX_ERROR_BODY_CHARS ? body : body.substring(0, MAX_ERROR_BODY_CHARS) + "...";
    }
}
