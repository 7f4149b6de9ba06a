/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.resilience;

import com.cadena.application.gateway.GatewayResultStatus;
import com.fasterxml.jackson.databind.JsonNode;

public record CallOutcome(
        GatewayResultStatus status,
        String providerId,
        JsonNode payload,
        int attempts,
        String detail
) {
    public static CallOutcome success(String providerId, JsonNode payload, int attempts) {
        return new CallOutcome(GatewayResultStatus.SUCCESS, providerId, payload, attempts, null);
    }

    public static CallOutcome degraded(String providerId, JsonNode payload, String detail) {
        return new CallOutcome(GatewayResultStatus.DEGRADED, providerId, payload, 0, detail);
    }

    public static CallOutcome failure(String providerId, int attempts, String detail) {
        return new CallOutcome(GatewayResultStatus.ERROR, providerId, null, attempts, detail);
    }

    public static CallOutcome noProvider(String detail) {
        return failure(null, 0, detail);
    }
}
