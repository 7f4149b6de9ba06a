/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.api.gateway;

import com.cadena.application.gateway.GatewayRequest;
import com.cadena.domain.model.Capability;
import com.cadena.domain.model.RoutingPolicy;
import com.cadena.domain.model.VolatilityTier;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Set;

public record GatewayRpcRequest(
        @NotBlank @Size(max = 128) String method,
        JsonNode params,
        VolatilityTier tier,
        Set<Capability> capabilities,
        String preferredProvider,
        RoutingPolicy policy
) {
    public GatewayRequest toGatewayRequest() {
        return new GatewayRequest(method, params, tier, capabilities, preferredProvider, policy);
    }
}
