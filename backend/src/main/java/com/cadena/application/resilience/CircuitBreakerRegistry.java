/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.resilience;

import com.cadena.config.AppProperties;
import com.cadena.domain.model.CircuitState;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class CircuitBreakerRegistry {
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;

    public CircuitBreakerRegistry(AppProperties properties, Clock clock) {
        this.failureThreshold = properties.circuitBreaker().failureThreshold();
        this.cooldown = properties.circuitBreaker().cooldown();
        this.clock = clock;
    }

    public CircuitBreaker forProvider(String providerId) {
        return breakers.computeIfAbsent(providerId, id -> new CircuitBreaker(id, failureThreshold, cooldown));
    }

    public CircuitState state(String providerId) {
        return forProvider(providerId).state(clock.instant());
    }
}
