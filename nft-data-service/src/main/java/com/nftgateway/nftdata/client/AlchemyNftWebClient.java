package com.nftgateway.nftdata.client;

import com.nftgateway.nftdata.model.AlchemyOwnedNftsResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Thin client for the Alchemy NFT API. Non-2xx answers surface as
 * {@link com.nftgateway.common.error.UpstreamStatusException} through the status filter
 * installed in {@link com.nftgateway.nftdata.config.WebClientConfig}; retrying is the
 * caller's concern.
 */
public class AlchemyNftWebClient {

    private static final Logger log = LoggerFactory.getLogger(AlchemyNftWebClient.class);

    private static final String OWNED_NFTS_PATH = "/nft/v3/{apiKey}/getNFTsForOwner";

    private final WebClient webClient;
    private final String apiKey;

    public AlchemyNftWebClient(WebClient alchemyWebClient, String apiKey) {
        this.webClient = alchemyWebClient;
        this.apiKey    = apiKey;
    }

    /**
     * NFTs held by {@code owner}, newest transfers first, with metadata.
     *
     * @param pageKey  cursor from a previous page, or {@code null} for the first page
     * @param pageSize 1..100
     */
    public Mono<AlchemyOwnedNftsResponse> getNftsForOwner(String owner, String pageKey, int pageSize) {
        return webClient.get()
            .uri(uriBuilder -> {
                uriBuilder
                    .path(OWNED_NFTS_PATH)
                    .queryParam("owner", owner)
                    .queryParam("pageSize", pageSize)
                    .queryParam("withMetadata", true)
                    .queryParam("orderBy", "transferTime");
                if (pageKey != null && !pageKey.isBlank()) {
                    uriBuilder.queryParam("pageKey", pageKey);
                }
                return uriBuilder.build(apiKey);
            })
            .retrieve()
            .bodyToMono(AlchemyOwnedNftsResponse.class)
            .doOnSuccess(r -> log.info("Owned NFTs fetched. owner={} returned={} hasNextPage={}",
                owner, r != null ? r.ownedNftsOrEmpty().size() : 0, r != null && r.pageKey() != null))
            .doOnError(e -> log.warn("Owned NFTs fetch failed. owner={} error={}", owner, e.getMessage()));
    }
}
