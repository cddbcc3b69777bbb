package com.z254.vigil.warden.policy;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Firing history of one policy on one component. Not thread-safe; only mutated while the
 * owning component entry is being computed.
 */
final class FiringWindow {

    static final Duration RATE_WINDOW = Duration.ofHours(1);

    private final Deque<Instant> firings = new ArrayDeque<>();
    private Instant lastFired;

    boolean inCooldown(Instant now, Duration cooldown) {
        return lastFired != null && now.isBefore(lastFired.plus(cooldown));
    }

    /**
     * Number of firings within the rolling hour ending at {@code now}.
     */
    int firingsInWindow(Instant now) {
        Instant horizon = now.minus(RATE_WINDOW);
        while (!firings.isEmpty() && !firings.peekFirst().isAfter(horizon)) {
            firings.pollFirst();
        }
        return firings.size();
    }

    void record(Instant now) {
        firings.addLast(now);
        lastFired = now;
    }

    /**
     * Undo a tentative firing recorded at {@code firedAt}.
     */
    void rollback(Instant firedAt, Instant previousFiring) {
        firings.removeLastOccurrence(firedAt);
        if (firedAt.equals(lastFired)) {
            lastFired = firings.isEmpty() ? previousFiring : firings.peekLast();
        }
    }

    Instant lastFired() {
        return lastFired;
    }
}
