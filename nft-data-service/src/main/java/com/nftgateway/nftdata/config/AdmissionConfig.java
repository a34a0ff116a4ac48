package com.nftgateway.nftdata.config;

import com.nftgateway.common.admission.AdmissionLimiter;
import com.nftgateway.common.admission.FixedWindowAdmissionLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(RateLimitProperties.class)
public class AdmissionConfig {

    private static final Logger log = LoggerFactory.getLogger(AdmissionConfig.class);

    @Bean
    public AdmissionLimiter admissionLimiter(RateLimitProperties properties, Clock clock) {
        if (properties.isDisabled()) {
            log.info("Inbound rate limiting disabled");
            return AdmissionLimiter.disabled();
        }
        if (!properties.isKnownMode()) {
            log.warn("Unrecognised ratelimit.mode '{}', applying development limit {}. Expected '{}' or '{}'",
                     properties.getMode(), properties.getMaxDevelopment(),
                     RateLimitProperties.PRODUCTION, RateLimitProperties.DEVELOPMENT);
        }
        log.info("Inbound rate limiting enabled. mode={} max={} windowSeconds={}",
                 properties.getMode(), properties.effectiveMax(), properties.getWindow().toSeconds());
        return new FixedWindowAdmissionLimiter(properties.effectiveMax(), properties.getWindow(), clock);
    }
}
