package com.nftgateway.common.admission;

/**
 * Gate in front of the request pipeline, keyed by client identity.
 */
public interface AdmissionLimiter {

    AdmissionDecision tryAdmit(String clientIdentity);

    /** Forgets the window of one identity. */
    void reset(String clientIdentity);

    /** Limiter that admits everything, used when rate limiting is switched off. */
    static AdmissionLimiter disabled() {
        return new AdmissionLimiter() {
            @Override
            public AdmissionDecision tryAdmit(String clientIdentity) {
                return AdmissionDecision.unlimited();
            }

            @Override
            public void reset(String clientIdentity) {
            }
        };
    }
}
