/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.gateway;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record GatewayResult(
        GatewayResultStatus status,
        String provider,
        JsonNode payload,
        int attempts,
        List<String> providersTried,
        String detail,
        boolean fromCache
) {
    public static final String SYNTHETIC_PROVIDER = "synthetic";

    public GatewayResult {
        providersTried = providersTried == null ? List.of() : List.copyOf(providersTried);
    }

    public boolean isSuccess() {
        return status == GatewayResultStatus.SUCCESS;
    }

    public GatewayResult detached() {
        JsonNode copy = payload == null ? null : payload.deepCopy();
        return new GatewayResult(status, provider, copy, attempts, providersTried, detail, fromCache);
    }

    public GatewayResult asCached() {
        return new GatewayResult(status, provider, payload, 0, List.of(), detail, true);
    }
}
