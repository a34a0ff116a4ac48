package com.nftgateway.nftdata.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Successful page, exactly as cached and as returned to callers.
 *
 * <p>{@code summary} is operation-specific (e.g. the per-collection breakdown of an NFT page)
 * and omitted when the operation provides none.
 */
@JsonPropertyOrder({"items", "pagination", "totalCount", "summary"})
public record PagedResult(
    @JsonProperty("items")      List<JsonNode> items,
    @JsonProperty("pagination") Pagination     pagination,
    @JsonProperty("totalCount") int            totalCount,
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("summary")    JsonNode       summary
) implements OperationResponse {

    @Override
    public boolean failed() {
        return false;
    }
}
