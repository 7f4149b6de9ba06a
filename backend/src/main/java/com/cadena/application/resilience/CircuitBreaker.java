/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.resilience;

import com.cadena.domain.model.CircuitState;

import java.time.Duration;
import java.time.Instant;

/**
 * Consecutive-failure circuit breaker for one provider.
 * <p>
 * CLOSED opens after {@code failureThreshold} consecutive failures. OPEN reports HALF_OPEN once the cooldown
 * has elapsed; HALF_OPEN admits a single trial call at a time, closes on its success and reopens on its failure.
 */
public final class CircuitBreaker {
    private final String providerId;
    private final int failureThreshold;
    private final Duration cooldown;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;
    private Instant lastFailureAt;
    private boolean trialInFlight;

    public CircuitBreaker(String providerId, int failureThreshold, Duration cooldown) {
        if (failureThreshold < 1) throw new IllegalArgumentException("failureThreshold must be >= 1");
        this.providerId = providerId;
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
    }

    public String providerId() {
        return providerId;
    }

    public synchronized Permit acquire(Instant now) {
        CircuitState effective = state(now);
        if (effective == CircuitState.CLOSED) return Permit.CALL;
        if (effective == CircuitState.OPEN || trialInFlight) return Permit.DENIED;
        state = CircuitState.HALF_OPEN;
        trialInFlight = true;
        return Permit.TRIAL;
    }

    public boolean allowRequest(Instant now) {
        return acquire(now) != Permit.DENIED;
    }

    public synchronized CircuitState onSuccess() {
        state = CircuitState.CLOSED;
        consecutiveFailures = 0;
        openedAt = null;
        trialInFlight = false;
        return state;
    }

    public synchronized CircuitState onFailure(Instant now) {
        lastFailureAt = now;
        consecutiveFailures++;
        CircuitState effective = state(now);
        if (effective == CircuitState.HALF_OPEN) {
            open(now);
        } else if (effective == CircuitState.CLOSED && consecutiveFailures >= failureThreshold) {
            open(now);
        }
        return state;
    }

    public synchronized void release(Permit permit) {
        if (permit == Permit.TRIAL) {
            trialInFlight = false;
        }
    }

    public synchronized CircuitState state(Instant now) {
        if (state != CircuitState.OPEN) return state;
        if (openedAt != null && !now.isBefore(openedAt.plus(cooldown))) {
            return CircuitState.HALF_OPEN;
        }
        return CircuitState.OPEN;
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized Instant lastFailureAt() {
        return lastFailureAt;
    }

    public enum Permit {
        DENIED,
        CALL,
        TRIAL
    }

    private void open(Instant now) {
        state = CircuitState.OPEN;
        openedAt = now;
        trialInFlight = false;
    }
}
