package com.nftgateway.nftdata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound call body. {@code pageSize} defaults to 100 downstream when absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OperationRequest(
    @JsonProperty("identityParam")    String  identityParam,
    @JsonProperty("paginationCursor") String  paginationCursor,
    @JsonProperty("pageSize")         Integer pageSize
) {}
