package com.nftgateway.nftdata.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.nftgateway.common.admission.AdmissionDecision;
import com.nftgateway.common.admission.AdmissionLimiter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AdmissionConfigTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
    private final RateLimitProperties properties = new RateLimitProperties();
    private final Logger configLogger = (Logger) LoggerFactory.getLogger(AdmissionConfig.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attachAppender() {
        appender.start();
        configLogger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        configLogger.detachAppender(appender);
    }

    private List<ILoggingEvent> warnings() {
        return appender.list.stream().filter(e -> e.getLevel() == Level.WARN).toList();
    }

    @Test
    @DisplayName("production mode, any case → production max, no warning")
    void productionMode() {
        properties.setMode("PRODUCTION");

        AdmissionDecision decision = new AdmissionConfig().admissionLimiter(properties, clock).tryAdmit("a");

        assertTrue(properties.isKnownMode());
        assertEquals(75, decision.limit());
        assertTrue(warnings().isEmpty());
    }

    @Test
    @DisplayName("misspelt mode → development max and a warning naming the value")
    void unknownModeWarns() {
        properties.setMode("prod");

        AdmissionDecision decision = new AdmissionConfig().admissionLimiter(properties, clock).tryAdmit("a");

        assertFalse(properties.isKnownMode());
        assertEquals(1000, decision.limit());
        assertEquals(1, warnings().size());
        assertTrue(warnings().get(0).getFormattedMessage().contains("'prod'"));
    }

    @Test
    @DisplayName("kill switch → disabled limiter regardless of mode")
    void disabled() {
        properties.setDisabled(true);
        properties.setMode("prod");

        AdmissionLimiter limiter = new AdmissionConfig().admissionLimiter(properties, clock);

        assertFalse(limiter.tryAdmit("a").isLimited());
        assertTrue(warnings().isEmpty());
    }
}
