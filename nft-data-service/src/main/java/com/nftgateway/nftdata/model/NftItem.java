package com.nftgateway.nftdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Compact view of one owned NFT; {@code name} and {@code imageUrl} are {@code null} when
 * the upstream has no metadata.
 */
public record NftItem(
    @JsonProperty("tokenId")         String tokenId,
    @JsonProperty("contractAddress") String contractAddress,
    @JsonProperty("name")            String name,
    @JsonProperty("imageUrl")        String imageUrl
) {}
