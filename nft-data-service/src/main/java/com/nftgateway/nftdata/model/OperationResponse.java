package com.nftgateway.nftdata.model;

/**
 * Everything the orchestrator returns: a {@link PagedResult} or an {@link ErrorPayload}.
 * Failures are values of this type, never error signals.
 */
public interface OperationResponse {

    boolean failed();
}
