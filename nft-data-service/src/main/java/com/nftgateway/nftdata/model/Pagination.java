package com.nftgateway.nftdata.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

public record Pagination(
    @JsonProperty("pageSize")      int     pageSize,
    @JsonProperty("hasNextPage")   boolean hasNextPage,
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("nextPageKey")   String  nextPageKey,
    @JsonProperty("totalReturned") int     totalReturned
) {}
