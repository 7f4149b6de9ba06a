/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.routing;

import com.cadena.domain.model.CircuitState;
import com.cadena.domain.model.ProviderHealth;

import java.time.Instant;

public record ProviderSnapshot(
        String providerId,
        CircuitState circuitState,
        ProviderHealth health,
        double averageLatencyMs,
        double successRate,
        boolean overQuota,
        boolean rateLimited,
        double remainingQuotaFraction,
        int consecutiveFailures,
        Instant lastFailureAt
) {
    public boolean routable() {
        return circuitState != CircuitState.OPEN && !overQuota && !rateLimited;
    }
}
