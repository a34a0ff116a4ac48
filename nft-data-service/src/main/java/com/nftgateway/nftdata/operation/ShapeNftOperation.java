package com.nftgateway.nftdata.operation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nftgateway.nftdata.client.AlchemyNftWebClient;
import com.nftgateway.nftdata.model.AlchemyOwnedNftsResponse;
import com.nftgateway.nftdata.model.AlchemyOwnedNftsResponse.OwnedNft;
import com.nftgateway.nftdata.model.CollectionSummary;
import com.nftgateway.nftdata.model.NftItem;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@code getShapeNft}: NFTs owned by a wallet address on Shape, one page at a time.
 *
 * <p>Items are reduced to {@link NftItem}. The page summary lists each collection seen on
 * the page with its owned count, in first-seen order, and is omitted for an empty page.
 */
@Component
public class ShapeNftOperation implements PagedOperation {

    public static final String NAME = "getShapeNft";

    static final Duration CACHE_TTL = Duration.ofMinutes(10);

    private final AlchemyNftWebClient client;
    private final ObjectMapper objectMapper;

    public ShapeNftOperation(AlchemyNftWebClient client, ObjectMapper objectMapper) {
        this.client       = client;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<Duration> cacheTtl() {
        return Optional.of(CACHE_TTL);
    }

    @Override
    public Mono<UpstreamPage> fetchPage(String identityParam, String cursor, int pageSize) {
        return client.getNftsForOwner(identityParam, cursor, pageSize)
            .switchIfEmpty(Mono.error(new IllegalStateException("Empty response from NFT API for owner " + identityParam)))
            .map(this::toPage);
    }

    UpstreamPage toPage(AlchemyOwnedNftsResponse response) {
        List<OwnedNft> owned = response.ownedNftsOrEmpty();

        List<JsonNode> items = new ArrayList<>(owned.size());
        for (OwnedNft nft : owned) {
            items.add(objectMapper.valueToTree(toItem(nft)));
        }

        JsonNode summary = owned.isEmpty() ? null : objectMapper.valueToTree(summarizeCollections(owned));
        return new UpstreamPage(items, response.pageKey(), response.totalCount(), summary);
    }

    private static NftItem toItem(OwnedNft nft) {
        String imageUrl = null;
        if (nft.image() != null) {
            imageUrl = nft.image().originalUrl() != null ? nft.image().originalUrl() : nft.image().thumbnailUrl();
        }
        return new NftItem(nft.tokenId(), contractAddress(nft), nft.name(), imageUrl);
    }

    private static List<CollectionSummary> summarizeCollections(List<OwnedNft> owned) {
        Map<String, String> names = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (OwnedNft nft : owned) {
            String address = contractAddress(nft);
            names.putIfAbsent(address, nft.contract() != null ? nft.contract().name() : null);
            counts.merge(address, 1, Integer::sum);
        }
        List<CollectionSummary> summary = new ArrayList<>(counts.size());
        counts.forEach((address, count) -> summary.add(new CollectionSummary(address, names.get(address), count)));
        return summary;
    }

    private static String contractAddress(OwnedNft nft) {
        return nft.contract() != null ? nft.contract().address() : null;
    }
}
