package com.z254.vigil.warden.policy;

import com.z254.vigil.warden.domain.model.CandidateAction;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Policy firings recorded by {@link PolicyEngine#reserve} but not yet settled.
 * <p>
 * Exactly one of {@link #commit()} or {@link #release()} takes effect; the other becomes a no-op.
 * Releasing rolls the cooldown and rate counters back as if the policies had not fired.
 */
public final class PolicyFirings {

    private enum State { PENDING, COMMITTED, RELEASED }

    record Reservation(String policyName, Instant firedAt, Instant previousFiring) {
    }

    private final PolicyEngine engine;
    private final String component;
    private final List<CandidateAction> candidates;
    private final List<Reservation> reservations;
    private final AtomicReference<State> state = new AtomicReference<>(State.PENDING);

    PolicyFirings(PolicyEngine engine, String component, List<CandidateAction> candidates,
                  List<Reservation> reservations) {
        this.engine = engine;
        this.component = component;
        this.candidates = List.copyOf(candidates);
        this.reservations = List.copyOf(reservations);
    }

    /**
     * @return candidate actions ordered by policy priority, then by each policy's action order
     */
    public List<CandidateAction> candidates() {
        return candidates;
    }

    public String component() {
        return component;
    }

    /**
     * @return true if this call committed the firings
     */
    public boolean commit() {
        if (state.compareAndSet(State.PENDING, State.COMMITTED)) {
            engine.committed(this);
            return true;
        }
        return false;
    }

    /**
     * @return true if this call rolled the firings back
     */
    public boolean release() {
        if (state.compareAndSet(State.PENDING, State.RELEASED)) {
            engine.released(this);
            return true;
        }
        return false;
    }

    List<Reservation> reservations() {
        return reservations;
    }
}
