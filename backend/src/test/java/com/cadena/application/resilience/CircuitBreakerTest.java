/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.resilience;

import com.cadena.domain.model.CircuitState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CircuitBreakerTest {
    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private final CircuitBreaker breaker = new CircuitBreaker("alpha", 3, Duration.ofSeconds(30));

    @Test
    void opensAfterConsecutiveFailuresAndBlocksUntilCooldown() {
        breaker.onFailure(T0);
        breaker.onFailure(T0);
        assertEquals(CircuitState.CLOSED, breaker.state(T0));
        assertTrue(breaker.allowRequest(T0));

        breaker.onFailure(T0);

        assertEquals(CircuitState.OPEN, breaker.state(T0));
        assertFalse(breaker.allowRequest(T0.plusSeconds(29)));
        assertEquals(CircuitState.HALF_OPEN, breaker.state(T0.plusSeconds(30)));
    }

    @Test
    void successResetsTheFailureCount() {
        breaker.onFailure(T0);
        breaker.onFailure(T0);
        breaker.onSuccess();
        breaker.onFailure(T0);
        breaker.onFailure(T0);

        assertEquals(CircuitState.CLOSED, breaker.state(T0));
        assertEquals(2, breaker.consecutiveFailures());
    }

    @Test
    void halfOpenAdmitsOneTrialCallAndClosesOnSuccess() {
        tripOpen();
        Instant later = T0.plusSeconds(31);

        assertTrue(breaker.allowRequest(later));
        assertFalse(breaker.allowRequest(later));

        assertEquals(CircuitState.CLOSED, breaker.onSuccess());
        assertTrue(breaker.allowRequest(later));
    }

    @Test
    void halfOpenFailureReopensAndRestartsCooldown() {
        tripOpen();
        Instant trialAt = T0.plusSeconds(31);
        assertTrue(breaker.allowRequest(trialAt));

        assertEquals(CircuitState.OPEN, breaker.onFailure(trialAt));
        assertEquals(trialAt, breaker.lastFailureAt());
        assertEquals(CircuitState.OPEN, breaker.state(trialAt.plusSeconds(29)));
        assertEquals(CircuitState.HALF_OPEN, breaker.state(trialAt.plusSeconds(30)));
    }

    @Test
    void releasedTrialCanBeTakenAgain() {
        tripOpen();
        Instant later = T0.plusSeconds(31);
        CircuitBreaker.Permit trial = breaker.acquire(later);
        assertEquals(CircuitBreaker.Permit.TRIAL, trial);

        breaker.release(trial);

        assertEquals(CircuitBreaker.Permit.TRIAL, breaker.acquire(later));
    }

    @Test
    void releasingAClosedPermitKeepsAnotherCallersTrial() {
        CircuitBreaker.Permit stale = breaker.acquire(T0);
        assertEquals(CircuitBreaker.Permit.CALL, stale);
        tripOpen();
        Instant later = T0.plusSeconds(31);
        assertEquals(CircuitBreaker.Permit.TRIAL, breaker.acquire(later));

        breaker.release(stale);

        assertEquals(CircuitBreaker.Permit.DENIED, breaker.acquire(later));
    }

    private void tripOpen() {
        for (int i = 0; i < 3; i++) {
            breaker.onFailure(T0);
        }
        assertEquals(CircuitState.OPEN, breaker.state(T0));
    }
}
