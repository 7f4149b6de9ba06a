/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.resilience;

import java.time.Duration;

// Not thread-safe: one schedule per provider attempt loop.
public final class RetrySchedule {
    private final RetryPolicy policy;
    private int attempts;
    private int retries;

    RetrySchedule(RetryPolicy policy) {
        this.policy = policy;
    }

    public void onAttempt() {
        attempts++;
    }

    public boolean canRetry() {
        return retries < policy.maxRetries();
    }

    public Duration nextDelay() {
        if (!canRetry()) {
            throw new IllegalStateException("No retries left");
        }
        return policy.delay(retries++);
    }

    public int attempts() {
        return attempts;
    }
}
