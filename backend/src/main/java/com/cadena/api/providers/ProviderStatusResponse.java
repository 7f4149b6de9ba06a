/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.api.providers;

import com.cadena.application.provider.ProviderUsage;
import com.cadena.domain.model.Capability;
import com.cadena.domain.model.CircuitState;
import com.cadena.domain.model.ProviderHealth;
import com.cadena.domain.model.RoutingPolicy;

import java.time.Instant;
import java.util.List;
import java.util.Set;

public record ProviderStatusResponse(
        RoutingPolicy policy,
        List<String> ranking,
        List<ProviderStatus> providers
) {
    public record ProviderStatus(
            String id,
            Set<Capability> capabilities,
            double costPerRequest,
            int priority,
            CircuitState circuitState,
            ProviderHealth health,
            double averageLatencyMs,
            double successRate,
            int consecutiveFailures,
            Instant lastFailureAt,
            ProviderUsage usage
    ) {}
}
