package com.nftgateway.nftdata.operation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One page as produced by an upstream fetch, before it is shaped into a
 * {@link com.nftgateway.nftdata.model.PagedResult}.
 *
 * @param nextCursor cursor for the following page, {@code null} on the last page
 * @param totalCount upstream total across all pages, {@code null} when not reported
 * @param summary    optional operation-specific digest of this page
 */
public record UpstreamPage(List<JsonNode> items, String nextCursor, Integer totalCount, JsonNode summary) {

    public UpstreamPage {
        items = items != null ? List.copyOf(items) : List.of();
    }
}
