package com.merlt.orchestrator.llm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Phase transitions of {@link ProviderCircuitBreaker}, driven by a manual clock.
 */
class ProviderCircuitBreakerTest {
    private final AtomicLong now = new AtomicLong(1_000L);
    private ProviderCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        breaker = new ProviderCircuitBreaker("ollama", 3, Duration.ofSeconds(30), 1, now::get);
    }

    @Test
    @DisplayName("Starts CLOSED and admits calls")
    void startsClosed() {
        assertEquals(ProviderCircuitBreaker.State.CLOSED, breaker.state());
        assertTrue(breaker.tryAcquire());
        assertEquals("ollama", breaker.provider());
        assertEquals(0L, breaker.retryAfterMs());
    }

    @Test
    @DisplayName("Opens at the failure threshold and reports when it will admit a probe")
    void opensAtThreshold() {
        trip();
        assertEquals(ProviderCircuitBreaker.State.OPEN, breaker.state());
        assertFalse(breaker.tryAcquire());
        assertEquals("IllegalStateException", breaker.lastFailure());
        now.addAndGet(10_000L);
        assertEquals(20_000L, breaker.retryAfterMs());
    }

    @Test
    @DisplayName("A success below the threshold starts the count again")
    void successResetsCount() {
        breaker.onFailure(new IllegalStateException("1"));
        breaker.onFailure(new IllegalStateException("2"));
        breaker.onSuccess();
        breaker.onFailure(new IllegalStateException("3"));
        assertEquals(ProviderCircuitBreaker.State.CLOSED, breaker.state());
    }

    @Test
    @DisplayName("Lets one probe through after the open period")
    void halfOpenAfterDuration() {
        trip();
        now.addAndGet(30_000L);
        assertTrue(breaker.tryAcquire());
        assertEquals(ProviderCircuitBreaker.State.HALF_OPEN, breaker.state());
        assertFalse(breaker.tryAcquire(), "Only one probe allowed while half-open");
    }

    @Test
    @DisplayName("A failed probe reopens, a successful one closes")
    void probeOutcome() {
        trip();
        now.addAndGet(30_000L);
        breaker.tryAcquire();
        breaker.onFailure(new IllegalStateException("probe"));
        assertEquals(ProviderCircuitBreaker.State.OPEN, breaker.state());
        assertEquals(30_000L, breaker.retryAfterMs());

        now.addAndGet(30_000L);
        assertTrue(breaker.tryAcquire());
        breaker.onSuccess();
        assertEquals(ProviderCircuitBreaker.State.CLOSED, breaker.state());
        assertTrue(breaker.tryAcquire());
    }

    @Test
    @DisplayName("Failures reported while open do not extend the open period")
    void failuresWhileOpen() {
        trip();
        now.addAndGet(20_000L);
        breaker.onFailure(new IllegalStateException("late"));
        assertEquals(10_000L, breaker.retryAfterMs());
    }

    private void trip() {
        for (int i = 0; i < 3; i++) {
            breaker.onFailure(new IllegalStateException("down"));
        }
    }
}
