/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.routing;

import com.cadena.application.provider.ProviderRegistry;
import com.cadena.application.provider.ProviderRuntimeStats;
import com.cadena.application.provider.ProviderUsage;
import com.cadena.application.provider.UsageTracker;
import com.cadena.application.resilience.CircuitBreaker;
import com.cadena.application.resilience.CircuitBreakerRegistry;
import com.cadena.domain.model.CircuitState;
import com.cadena.domain.model.ProviderDescriptor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

@Service
public class ProviderHealthService implements ProviderHealthReader {
    private final ProviderRegistry registry;
    private final CircuitBreakerRegistry breakers;
    private final UsageTracker usageTracker;
    private final Clock clock;

    public ProviderHealthService(
            ProviderRegistry registry,
            CircuitBreakerRegistry breakers,
            UsageTracker usageTracker,
            Clock clock
    ) {
        this.registry = registry;
        this.breakers = breakers;
        this.usageTracker = usageTracker;
        this.clock = clock;
    }

    @Override
    public ProviderSnapshot getSnapshot(String providerId) {
        CircuitBreaker breaker = breakers.forProvider(providerId);
        CircuitState circuitState = breaker.state(clock.instant());
        ProviderRuntimeStats stats = registry.stats(providerId);
        ProviderUsage usage = usageTracker.usage(providerId);
        return new ProviderSnapshot(
                providerId,
                circuitState,
                stats.health(circuitState),
                stats.averageLatencyMs(),
                stats.successRate(),
                usage.overQuota(),
                usageTracker.isRateLimited(providerId),
                usage.remainingFraction(),
                breaker.consecutiveFailures(),
                breaker.lastFailureAt()
        );
    }

    public List<ProviderSnapshot> getAllSnapshots() {
        return registry.listProviders().stream()
                .map(ProviderDescriptor::id)
                .map(this::getSnapshot)
                .toList();
    }
}
