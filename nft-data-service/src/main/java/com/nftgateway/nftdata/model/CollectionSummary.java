package com.nftgateway.nftdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** How many NFTs of one collection appear on the current page. */
public record CollectionSummary(
    @JsonProperty("contractAddress") String contractAddress,
    @JsonProperty("name")            String name,
    @JsonProperty("ownedCount")      int    ownedCount
) {}
