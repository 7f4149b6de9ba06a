/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.resilience;

import com.cadena.config.AppProperties;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with symmetric jitter.
 * Delay for the zero-based retry {@code n} is {@code min(base * 2^n, maxDelay)}, then scaled by {@code 1 ± jitter}.
 */
public final class RetryPolicy {
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitter;
    private final int maxRetries;
    private final DoubleSupplier random;

    public RetryPolicy(Duration baseDelay, Duration maxDelay, double jitter, int maxRetries, DoubleSupplier random) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (jitter < 0 || jitter >= 1) throw new IllegalArgumentException("jitter must be in [0, 1)");
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitter = jitter;
        this.maxRetries = maxRetries;
        this.random = random;
    }

    public static RetryPolicy from(AppProperties.Retry retry) {
        return new RetryPolicy(
                retry.baseDelay(),
                retry.maxDelay(),
                retry.jitter(),
                retry.maxRetries(),
                () -> ThreadLocalRandom.current().nextDouble()
        );
    }

    public Duration delay(int retry) {
        long base = baseDelay.toMillis();
        long cap = maxDelay.toMillis();
        long exponential = base << Math.min(Math.max(retry, 0), 30);
        if (exponential < 0 || exponential > cap) {
            exponential = cap;
        }
        double factor = 1.0 + (random.getAsDouble() * 2.0 - 1.0) * jitter;
        return Duration.ofMillis(Math.max(0, Math.round(exponential * factor)));
    }

    public int maxRetries() {
        return maxRetries;
    }

    public RetrySchedule newSchedule() {
        return new RetrySchedule(this);
    }
}
