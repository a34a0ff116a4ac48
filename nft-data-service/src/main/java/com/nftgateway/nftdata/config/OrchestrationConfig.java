package com.nftgateway.nftdata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.nftgateway.common.error.ErrorClassifier;
import com.nftgateway.common.error.StatusErrorClassifier;
import com.nftgateway.common.retry.BackoffRetrier;
import com.nftgateway.common.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class OrchestrationConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationConfig.class);

    @Value("${retry.max-retries:3}")
    private int maxRetries;

    @Value("${retry.base-delay:1000ms}")
    private Duration baseDelay;

    @Value("${retry.max-jitter:1000ms}")
    private Duration maxJitter;

    @Bean
    public BackoffRetrier backoffRetrier() {
        RetryPolicy policy = new RetryPolicy(maxRetries, baseDelay, maxJitter);
        log.info("Upstream retry policy. maxRetries={} baseDelayMs={} maxJitterMs={}",
                 policy.maxRetries(), policy.baseDelay().toMillis(), policy.maxJitter().toMillis());
        return new BackoffRetrier(policy);
    }

    @Bean
    public ErrorClassifier errorClassifier() {
        return new StatusErrorClassifier();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
