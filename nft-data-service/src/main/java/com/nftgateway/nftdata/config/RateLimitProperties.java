package com.nftgateway.nftdata.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Inbound rate limiting. Production mode is stricter than development; {@code disabled}
 * switches limiting off entirely.
 */
@Data
@ConfigurationProperties(prefix = "ratelimit")
public class RateLimitProperties {

    public static final String PRODUCTION = "production";
    public static final String DEVELOPMENT = "development";

    private boolean disabled = false;

    /** {@code production} or {@code development}. */
    private String mode = DEVELOPMENT;

    private Duration window = Duration.ofMinutes(15);

    private int maxProduction = 75;

    private int maxDevelopment = 1000;

    /** Checked in order for the client address; the first hop of the first present header wins. */
    private List<String> trustedHeaders = List.of("X-Forwarded-For");

    /** Requests whose path starts with one of these are counted. */
    private List<String> limitedPaths = List.of("/api/v1/operations", "/api/v1/nft");

    public boolean isProduction() {
        return PRODUCTION.equalsIgnoreCase(mode);
    }

    /** False for anything other than the two modes above, which then falls back to development limits. */
    public boolean isKnownMode() {
        return PRODUCTION.equalsIgnoreCase(mode) || DEVELOPMENT.equalsIgnoreCase(mode);
    }

    public int effectiveMax() {
        return isProduction() ? maxProduction : maxDevelopment;
    }
}
