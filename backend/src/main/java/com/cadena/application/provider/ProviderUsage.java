/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.provider;

import java.time.Instant;

public record ProviderUsage(
        String providerId,
        long used,
        long quota,
        double remainingFraction,
        double costThisPeriod,
        Instant periodStart,
        long projectedRequests,
        double projectedCost
) {
    public boolean overQuota() {
        return used >= quota;
    }

    public double usedFraction() {
        return 1.0 - remainingFraction;
    }
}
