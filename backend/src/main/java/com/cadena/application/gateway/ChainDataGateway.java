/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.gateway;

import com.cadena.application.cache.RequestFingerprint;
import com.cadena.application.cache.TieredResponseCache;
import com.cadena.application.resilience.ResilientExecutor;
import com.cadena.domain.model.VolatilityTier;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicBoolean;

@Service
public class ChainDataGateway {
    private final ResilientExecutor executor;
    private final TieredResponseCache<GatewayResult> cache;
    private final RequestFingerprint fingerprint;

    public ChainDataGateway(ResilientExecutor executor, TieredResponseCache<GatewayResult> cache, RequestFingerprint fingerprint) {
        this.executor = executor;
        this.cache = cache;
        this.fingerprint = fingerprint;
    }

    public GatewayResult call(GatewayRequest request) {
        String key = fingerprint.of(request.method(), request.params());
        AtomicBoolean computed = new AtomicBoolean();
        GatewayResult result = cache.getOrCompute(
                key,
                request.tier(),
                () -> {
                    computed.set(true);
                    return executor.execute(request);
                },
                GatewayResult::isSuccess
        );
        return computed.get() ? result : result.asCached();
    }

    public GatewayResult call(String method, JsonNode params, VolatilityTier tier) {
        return call(GatewayRequest.of(method, params, tier));
    }
}
