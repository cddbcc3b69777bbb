package com.z254.vigil.warden.resilience;

import com.z254.vigil.warden.config.WardenProperties;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Circuit breaker owned by a single protected resource.
 * <p>
 * {@code failureThreshold} consecutive failures open the breaker. While open, calls fail fast
 * with {@link CircuitOpenException} without touching the resource. Once the recovery timeout has
 * elapsed the next call moves the breaker to half-open and is let through as the single trial:
 * success closes the breaker, failure reopens it and restarts the timeout. The timeout is measured
 * on the injected {@link Clock}.
 */
@Slf4j
public class ResourceCircuitBreaker {

    private final String resource;
    private final CircuitBreaker delegate;
    private final Clock clock;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicReference<Instant> lastFailureAt = new AtomicReference<>();

    public ResourceCircuitBreaker(String resource, WardenProperties.Breaker settings, Clock clock) {
        this.resource = resource;
        this.clock = clock;
        int threshold = settings.getFailureThreshold();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100.0f)
                .permittedNumberOfCallsInHalfOpenState(1)
                .waitDurationInOpenState(settings.getRecoveryTimeout())
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .clock(clock)
                .writableStackTraceEnabled(false)
                .build();
        this.delegate = CircuitBreaker.of(resource, config);
        this.delegate.getEventPublisher().onStateTransition(event ->
                log.warn("Circuit breaker {} transitioned {}", resource, event.getStateTransition()));
    }

    /**
     * Invoke {@code operation} through the breaker.
     *
     * @throws CircuitOpenException if the breaker rejects the call
     */
    public <T> T call(Supplier<T> operation) {
        try {
            T result = delegate.executeSupplier(operation);
            onSuccess();
            return result;
        } catch (CallNotPermittedException e) {
            throw new CircuitOpenException(resource);
        } catch (RuntimeException e) {
            onFailure();
            throw e;
        }
    }

    /**
     * Reactive variant of {@link #call(Supplier)}; the breaker observes the {@link Mono}'s completion.
     */
    public <T> Mono<T> callReactive(Supplier<Mono<T>> operation) {
        return Mono.defer(operation)
                .transformDeferred(CircuitBreakerOperator.of(delegate))
                .doOnSuccess(ignored -> onSuccess())
                .onErrorMap(CallNotPermittedException.class, e -> new CircuitOpenException(resource))
                .doOnError(e -> {
                    if (!(e instanceof CircuitOpenException)) {
                        onFailure();
                    }
                });
    }

    /**
     * Whether a call issued now would be let through. Probing an expired open breaker moves it
     * to half-open without consuming the trial call.
     */
    public boolean isCallPermitted() {
        if (delegate.tryAcquirePermission()) {
            delegate.releasePermission();
            return true;
        }
        return false;
    }

    public BreakerState getState() {
        return switch (delegate.getState()) {
            case CLOSED, DISABLED, METRICS_ONLY -> BreakerState.CLOSED;
            case HALF_OPEN -> BreakerState.HALF_OPEN;
            case OPEN, FORCED_OPEN -> BreakerState.OPEN;
        };
    }

    public String getResource() {
        return resource;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public Instant getLastFailureAt() {
        return lastFailureAt.get();
    }

    private void onSuccess() {
        consecutiveFailures.set(0);
    }

    private void onFailure() {
        consecutiveFailures.incrementAndGet();
        lastFailureAt.set(clock.instant());
    }
}
