package com.nftgateway.common.error;

@FunctionalInterface
public interface ErrorClassifier {

    UpstreamErrorType classify(Throwable error);
}
