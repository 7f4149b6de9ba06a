/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.resilience;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    @Test
    void delaysDoubleUntilTheCap() {
        RetryPolicy policy = new RetryPolicy(Duration.ofMillis(100), Duration.ofMillis(500), 0.0, 5, () -> 0.5);

        assertEquals(Duration.ofMillis(100), policy.delay(0));
        assertEquals(Duration.ofMillis(200), policy.delay(1));
        assertEquals(Duration.ofMillis(400), policy.delay(2));
        assertEquals(Duration.ofMillis(500), policy.delay(3));
        assertEquals(Duration.ofMillis(500), policy.delay(40));
    }

    @Test
    void jitterStaysWithinBounds() {
        RetryPolicy low = new RetryPolicy(Duration.ofMillis(1000), Duration.ofSeconds(10), 0.25, 3, () -> 0.0);
        RetryPolicy high = new RetryPolicy(Duration.ofMillis(1000), Duration.ofSeconds(10), 0.25, 3, () -> 1.0);

        assertEquals(Duration.ofMillis(750), low.delay(0));
        assertEquals(Duration.ofMillis(1250), high.delay(0));
    }

    @Test
    void scheduleCountsRetriesWithoutSleeping() {
        RetryPolicy policy = new RetryPolicy(Duration.ofMillis(10), Duration.ofSeconds(1), 0.0, 2, () -> 0.5);
        RetrySchedule schedule = policy.newSchedule();

        schedule.onAttempt();
        assertTrue(schedule.canRetry());
        assertEquals(Duration.ofMillis(10), schedule.nextDelay());
        schedule.onAttempt();
        assertEquals(Duration.ofMillis(20), schedule.nextDelay());
        schedule.onAttempt();

        assertFalse(schedule.canRetry());
        assertEquals(3, schedule.attempts());
        assertThrows(IllegalStateException.class, schedule::nextDelay);
    }
}
