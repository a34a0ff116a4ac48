package com.nftgateway.common.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class CacheAccessGuardTest {

    private static final CacheKey KEY = CacheKey.of("mcp:360", "getShapeNft", "0xabc", null, 100);
    private static final Duration TTL = Duration.ofMinutes(10);

    private final CacheStoreAdapter adapter = mock(CacheStoreAdapter.class);
    private final CacheAccessGuard guard = new CacheAccessGuard(adapter, Duration.ofMillis(3000));

    @Nested
    @DisplayName("get()")
    class Get {

        @Test
        @DisplayName("stored value → HIT")
        void hit() {
            when(adapter.get(KEY.value())).thenReturn(Mono.just("{\"a\":1}"));

            StepVerifier.create(guard.get(KEY))
                .assertNext(lookup -> {
                    assertTrue(lookup.isHit());
                    assertEquals("{\"a\":1}", lookup.value());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("empty store → MISS")
        void miss() {
            when(adapter.get(KEY.value())).thenReturn(Mono.empty());

            StepVerifier.create(guard.get(KEY))
                .expectNext(CacheLookup.absent(CacheStatus.MISS))
                .verifyComplete();
        }

        @Test
        @DisplayName("adapter error → UNAVAILABLE, no error signal")
        void adapterError() {
            when(adapter.get(anyString())).thenReturn(Mono.error(new IllegalStateException("connection refused")));

            StepVerifier.create(guard.get(KEY))
                .expectNext(CacheLookup.absent(CacheStatus.UNAVAILABLE))
                .verifyComplete();
        }

        @Test
        @DisplayName("adapter throwing synchronously → UNAVAILABLE")
        void adapterThrows() {
            when(adapter.get(anyString())).thenThrow(new IllegalStateException("boom"));

            StepVerifier.create(guard.get(KEY))
                .expectNext(CacheLookup.absent(CacheStatus.UNAVAILABLE))
                .verifyComplete();
        }

        @Test
        @DisplayName("hanging adapter → TIMEOUT after 3000ms and the command is cancelled")
        void timeoutCancels() {
            AtomicBoolean cancelled = new AtomicBoolean();
            when(adapter.get(anyString())).thenReturn(Mono.<String>never().doOnCancel(() -> cancelled.set(true)));

            StepVerifier.withVirtualTime(() -> guard.get(KEY))
                .expectSubscription()
                .expectNoEvent(Duration.ofMillis(2999))
                .thenAwait(Duration.ofMillis(1))
                .expectNext(CacheLookup.absent(CacheStatus.TIMEOUT))
                .verifyComplete();

            assertTrue(cancelled.get());
        }
    }

    @Nested
    @DisplayName("set()")
    class Set {

        @Test
        @DisplayName("acknowledged write → STORED")
        void stored() {
            when(adapter.setWithExpiry(KEY.value(), "v", TTL)).thenReturn(Mono.just(true));

            StepVerifier.create(guard.set(KEY, "v", TTL))
                .expectNext(CacheStatus.STORED)
                .verifyComplete();
        }

        @Test
        @DisplayName("adapter error → UNAVAILABLE, no error signal")
        void adapterError() {
            when(adapter.setWithExpiry(anyString(), anyString(), any()))
                .thenReturn(Mono.error(new IllegalStateException("READONLY")));

            StepVerifier.create(guard.set(KEY, "v", TTL))
                .expectNext(CacheStatus.UNAVAILABLE)
                .verifyComplete();
        }

        @Test
        @DisplayName("hanging write → TIMEOUT")
        void timeout() {
            when(adapter.setWithExpiry(anyString(), anyString(), any())).thenReturn(Mono.never());

            StepVerifier.withVirtualTime(() -> guard.set(KEY, "v", TTL))
                .expectSubscription()
                .thenAwait(Duration.ofMillis(3000))
                .expectNext(CacheStatus.TIMEOUT)
                .verifyComplete();
        }
    }

    @Nested
    @DisplayName("disabled guard")
    class Disabled {

        private final CacheAccessGuard disabled = CacheAccessGuard.disabled();

        @Test
        @DisplayName("get → DISABLED immediately")
        void get() {
            assertFalse(disabled.isEnabled());
            StepVerifier.create(disabled.get(KEY))
                .expectNext(CacheLookup.absent(CacheStatus.DISABLED))
                .verifyComplete();
        }

        @Test
        @DisplayName("set → DISABLED, nothing stored")
        void set() {
            StepVerifier.create(disabled.set(KEY, "v", TTL))
                .expectNext(CacheStatus.DISABLED)
                .verifyComplete();
            verifyNoInteractions(adapter);
        }
    }
}
