package com.nftgateway.nftdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/**
 * Well-formed failure answer. Returned with HTTP 200 like any other payload.
 */
@JsonPropertyOrder({"error", "message", "identityParam", "timestamp"})
public record ErrorPayload(
    @JsonProperty("error")         boolean error,
    @JsonProperty("message")       String  message,
    @JsonProperty("identityParam") String  identityParam,
    @JsonProperty("timestamp")     Instant timestamp
) implements OperationResponse {

    public static ErrorPayload of(String message, String identityParam, Instant timestamp) {
        return new ErrorPayload(true, message, identityParam, timestamp);
    }

    @Override
    public boolean failed() {
        return true;
    }
}
