/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.provider;

import com.cadena.domain.model.CircuitState;
import com.cadena.domain.model.ProviderHealth;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

public final class ProviderRuntimeStats {
    static final double ALPHA = 0.1;
    static final double DEGRADED_SUCCESS_RATE = 0.5;

    private final ReentrantLock lock = new ReentrantLock();
    private double averageLatencyMs;
    private double successRate = 1.0;
    private long samples;
    private Instant lastCallAt;

    public void record(boolean success, long latencyMs, Instant at) {
        lock.lock();
        try {
            averageLatencyMs = samples == 0
                    ? latencyMs
                    : (1 - ALPHA) * averageLatencyMs + ALPHA * latencyMs;
            successRate = (1 - ALPHA) * successRate + ALPHA * (success ? 1.0 : 0.0);
            samples++;
            lastCallAt = at;
        } finally {
            lock.unlock();
        }
    }

    public double averageLatencyMs() {
        lock.lock();
        try {
            return averageLatencyMs;
        } finally {
            lock.unlock();
        }
    }

    public double successRate() {
        lock.lock();
        try {
            return successRate;
        } finally {
            lock.unlock();
        }
    }

    public long samples() {
        lock.lock();
        try {
            return samples;
        } finally {
            lock.unlock();
        }
    }

    public Instant lastCallAt() {
        lock.lock();
        try {
            return lastCallAt;
        } finally {
            lock.unlock();
        }
    }

    public ProviderHealth health(CircuitState circuitState) {
        if (circuitState == CircuitState.OPEN) return ProviderHealth.DOWN;
        if (circuitState == CircuitState.HALF_OPEN) return ProviderHealth.DEGRADED;
        return successRate() <= DEGRADED_SUCCESS_RATE ? ProviderHealth.DEGRADED : ProviderHealth.HEALTHY;
    }
}
