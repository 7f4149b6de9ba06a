/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.cache;

import com.cadena.domain.model.VolatilityTier;

import java.time.Duration;
import java.time.Instant;

public record CacheEntry<V>(
        String key,
        V value,
        VolatilityTier tier,
        Duration ttl,
        Instant expiresAt
) {
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
