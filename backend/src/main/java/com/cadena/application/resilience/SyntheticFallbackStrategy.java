/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.resilience;

import com.cadena.application.gateway.GatewayRequest;
import com.cadena.application.gateway.GatewayResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Set;

public class SyntheticFallbackStrategy implements ProviderCallStrategy {
    private final ObjectMapper objectMapper;

    public SyntheticFallbackStrategy(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "synthetic";
    }

    @Override
    public CallOutcome attempt(GatewayRequest request, Set<String> excluded) {
        String reason = excluded.isEmpty()
                ? "no eligible provider"
                : "all providers failed: " + String.join(",", excluded);
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("degraded", true);
        payload.put("method", request.method());
        payload.put("reason", reason);
        return CallOutcome.degraded(GatewayResult.SYNTHETIC_PROVIDER, payload, reason);
    }
}
