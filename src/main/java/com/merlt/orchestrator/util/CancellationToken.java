package com.merlt.orchestrator.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared by the tasks of one request. Child tokens are cancelled
 * with their parent; cancelling a child leaves the parent untouched.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final long deadlineEpochMs;
    private final List<CancellationToken> children = new ArrayList<>();
    private volatile String reason;

    private CancellationToken(long deadlineEpochMs) {
        this.deadlineEpochMs = deadlineEpochMs;
    }

    public static CancellationToken none() {
        return new CancellationToken(Long.MAX_VALUE);
    }

    public static CancellationToken withDeadline(long deadlineEpochMs) {
        return new CancellationToken(deadlineEpochMs);
    }

    public static CancellationToken withTimeout(long timeoutMs) {
        return new CancellationToken(System.currentTimeMillis() + Math.max(0L, timeoutMs));
    }

    /**
     * Creates a token that is cancelled when this one is, and whose deadline is the earlier of
     * this token's deadline and {@code timeoutMs} from now.
     */
    public CancellationToken child(long timeoutMs) {
        long childDeadline = Math.min(this.deadlineEpochMs, System.currentTimeMillis() + Math.max(0L, timeoutMs));
        CancellationToken child = new CancellationToken(childDeadline);
        synchronized (this.children) {
            this.children.add(child);
        }
        if (isCancelled()) {
            child.cancel(this.reason);
        }
        return child;
    }

    public void cancel(String why) {
        if (this.cancelled.compareAndSet(false, true)) {
            this.reason = why;
            List<CancellationToken> snapshot;
            synchronized (this.children) {
                snapshot = new ArrayList<>(this.children);
            }
            snapshot.forEach(c -> c.cancel(why));
        }
    }

    public boolean isCancelled() {
        return this.cancelled.get();
    }

    public boolean isExpired() {
        return System.currentTimeMillis() >= this.deadlineEpochMs;
    }

    public boolean shouldStop() {
        return isCancelled() || isExpired();
    }

    public long remainingMs() {
        if (this.deadlineEpochMs == Long.MAX_VALUE) {
            return Long.MAX_VALUE;
        }
        return Math.max(0L, this.deadlineEpochMs - System.currentTimeMillis());
    }

    public String getReason() {
        return this.reason;
    }
}
