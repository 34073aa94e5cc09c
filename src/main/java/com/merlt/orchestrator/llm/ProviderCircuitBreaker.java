package com.merlt.orchestrator.llm;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * Breaker guarding one language-model provider. After {@code failureThreshold} consecutive
 * failed calls the provider is skipped for {@code openDuration}; then up to
 * {@code probeCalls} calls are let through and the first outcome decides whether it closes
 * again or stays open for another period.
 *
 * <p>The whole state is one immutable {@link Phase} swapped atomically, so a transition never
 * mixes counters from two phases.</p>
 */
public class ProviderCircuitBreaker {
    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private record Phase(State state, int failures, int probes, long openUntilMs) {
        static final Phase CLOSED = new Phase(State.CLOSED, 0, 0, 0L);
    }

    private final String provider;
    private final int failureThreshold;
    private final int probeCalls;
    private final long openMs;
    private final LongSupplier clock;
    private final AtomicReference<Phase> phase = new AtomicReference<>(Phase.CLOSED);
    private volatile String lastFailure;

    public ProviderCircuitBreaker(String provider, int failureThreshold, Duration openDuration, int probeCalls) {
        this(provider, failureThreshold, openDuration, probeCalls, System::currentTimeMillis);
    }

    ProviderCircuitBreaker(String provider, int failureThreshold, Duration openDuration, int probeCalls, LongSupplier clock) {
        this.provider = provider == null ? "default" : provider;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openMs = (openDuration == null ? Duration.ofSeconds(30) : openDuration).toMillis();
        this.probeCalls = Math.max(1, probeCalls);
        this.clock = clock;
    }

    /**
     * @return whether a call may go to the provider now; a granted half-open probe is counted
     */
    public boolean tryAcquire() {
        long now = this.clock.getAsLong();
        Phase next = this.phase.updateAndGet(current -> switch (current.state()) {
            case CLOSED -> current;
            case OPEN -> now < current.openUntilMs() ? current : new Phase(State.HALF_OPEN, 0, 1, 0L);
            case HALF_OPEN -> new Phase(State.HALF_OPEN, 0, Math.min(current.probes() + 1, this.probeCalls + 1), 0L);
        });
        return next.state() == State.CLOSED || next.probes() <= this.probeCalls;
    }

    public void onSuccess() {
        this.phase.set(Phase.CLOSED);
    }

    public void onFailure(Throwable error) {
        this.lastFailure = error == null ? "unknown" : error.getClass().getSimpleName();
        long now = this.clock.getAsLong();
        this.phase.updateAndGet(current -> {
            if (current.state() == State.OPEN) {
                return current;
            }
            int failures = current.failures() + 1;
            if (current.state() == State.HALF_OPEN || failures >= this.failureThreshold) {
                return new Phase(State.OPEN, 0, 0, now + this.openMs);
            }
            return new Phase(State.CLOSED, failures, 0, 0L);
        });
    }

    /** Milliseconds until an open breaker admits a probe, 0 otherwise. */
    public long retryAfterMs() {
        Phase current = this.phase.get();
        if (current.state() != State.OPEN) {
            return 0L;
        }
        return Math.max(0L, current.openUntilMs() - this.clock.getAsLong());
    }

    public State state() {
        return this.phase.get().state();
    }

    public String provider() {
        return this.provider;
    }

    public String lastFailure() {
        return this.lastFailure;
    }
}
