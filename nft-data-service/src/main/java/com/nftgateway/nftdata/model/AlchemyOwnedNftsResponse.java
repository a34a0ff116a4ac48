package com.nftgateway.nftdata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Subset of Alchemy's {@code getNFTsForOwner} (NFT API v3) response that the gateway reads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlchemyOwnedNftsResponse(
    @JsonProperty("ownedNfts")  List<OwnedNft> ownedNfts,
    @JsonProperty("totalCount") Integer totalCount,
    @JsonProperty("pageKey")    String pageKey
) {

    public List<OwnedNft> ownedNftsOrEmpty() {
        return ownedNfts != null ? ownedNfts : List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OwnedNft(
        @JsonProperty("contract") Contract contract,
        @JsonProperty("tokenId")  String   tokenId,
        @JsonProperty("name")     String   name,
        @JsonProperty("image")    Image    image
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Contract(
        @JsonProperty("address") String address,
        @JsonProperty("name")    String name
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Image(
        @JsonProperty("originalUrl")  String originalUrl,
        @JsonProperty("thumbnailUrl") String thumbnailUrl
    ) {}
}
