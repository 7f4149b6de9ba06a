/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.gateway;

import com.cadena.domain.model.Capability;
import com.cadena.domain.model.RoutingPolicy;
import com.cadena.domain.model.VolatilityTier;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;

public record GatewayRequest(
        String method,
        JsonNode params,
        VolatilityTier tier,
        Set<Capability> capabilities,
        String preferredProvider,
        RoutingPolicy policy
) {
    public GatewayRequest {
        if (method == null || method.isBlank()) throw new IllegalArgumentException("method is required");
        tier = tier == null ? VolatilityTier.WARM : tier;
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }

    public static GatewayRequest of(String method, JsonNode params, VolatilityTier tier) {
        return new GatewayRequest(method, params, tier, Set.of(), null, null);
    }
}
