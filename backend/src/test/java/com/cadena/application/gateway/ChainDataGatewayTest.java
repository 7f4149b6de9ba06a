/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.gateway;

import com.cadena.application.cache.RequestFingerprint;
import com.cadena.application.cache.TieredResponseCache;
import com.cadena.application.metrics.MetricsCollector;
import com.cadena.application.provider.ProviderRegistry;
import com.cadena.application.provider.UsageTracker;
import com.cadena.application.resilience.ResilientExecutor;
import com.cadena.config.AppProperties;
import com.cadena.domain.model.VolatilityTier;
import com.cadena.support.MutableClock;
import com.cadena.support.TestProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChainDataGatewayTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final MutableClock clock = MutableClock.at("2025-02-01T00:00:00Z");

    @Mock
    ResilientExecutor executor;

    private ChainDataGateway gateway;

    @BeforeEach
    void setUp() {
        AppProperties properties = TestProperties.defaults();
        UsageTracker usage = new UsageTracker(new ProviderRegistry(properties), properties, clock);
        MetricsCollector metrics = new MetricsCollector(new SimpleMeterRegistry(), usage, clock);
        gateway = new ChainDataGateway(executor, new TieredResponseCache<>(properties.cache(), GatewayResult::detached, metrics, clock),
                new RequestFingerprint(mapper));
    }

    @Test
    void successfulAnswersAreServedFromCacheOnRepeat() {
        ObjectNode params = mapper.createObjectNode().put("id", "mint1");
        when(executor.execute(any())).thenReturn(new GatewayResult(GatewayResultStatus.SUCCESS, "alpha",
                mapper.createObjectNode().put("name", "Token"), 1, List.of("alpha"), null, false));

        GatewayResult first = gateway.call("getAsset", params, VolatilityTier.FROZEN);
        GatewayResult second = gateway.call("getAsset", params.deepCopy(), VolatilityTier.FROZEN);

        assertFalse(first.fromCache());
        assertEquals(1, first.attempts());
        assertTrue(second.fromCache());
        assertEquals(0, second.attempts());
        assertEquals("Token", second.payload().get("name").asText());
        verify(executor, times(1)).execute(any());
    }

    @Test
    void mutatingAReturnedPayloadLeavesTheCachedEntryIntact() {
        when(executor.execute(any())).thenReturn(new GatewayResult(GatewayResultStatus.SUCCESS, "alpha",
                mapper.createObjectNode().put("name", "Token"), 1, List.of("alpha"), null, false));

        GatewayResult first = gateway.call("getAsset", null, VolatilityTier.FROZEN);
        ((ObjectNode) first.payload()).put("name", "changed");
        GatewayResult second = gateway.call("getAsset", null, VolatilityTier.FROZEN);
        ((ObjectNode) second.payload()).remove("name");
        GatewayResult third = gateway.call("getAsset", null, VolatilityTier.FROZEN);

        assertEquals("Token", second.payload().get("name").asText());
        assertEquals("Token", third.payload().get("name").asText());
    }

    @Test
    void degradedAnswersAreNeverCached() {
        when(executor.execute(any())).thenReturn(new GatewayResult(GatewayResultStatus.DEGRADED,
                GatewayResult.SYNTHETIC_PROVIDER, mapper.createObjectNode(), 0, List.of(), "no eligible provider", false));

        gateway.call("getSlot", null, VolatilityTier.HOT);
        GatewayResult again = gateway.call("getSlot", null, VolatilityTier.HOT);

        assertEquals(GatewayResultStatus.DEGRADED, again.status());
        assertFalse(again.fromCache());
        verify(executor, times(2)).execute(any());
    }
}
