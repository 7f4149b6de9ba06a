/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.ingestion;

import com.cadena.application.gateway.ChainDataGateway;
import com.cadena.application.gateway.GatewayRequest;
import com.cadena.application.gateway.GatewayResult;
import com.cadena.application.gateway.GatewayResultStatus;
import com.cadena.application.signals.TokenLaunches;
import com.cadena.config.AppProperties;
import com.cadena.domain.model.Capability;
import com.cadena.domain.model.ChainEvent;
import com.cadena.domain.model.VolatilityTier;
import com.cadena.support.TestProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TokenMetadataEnricherTest {
    private static final String MINT = "NewMint1111111111111111111111111111111111";

    private final ObjectMapper mapper = new ObjectMapper();
    private final AppProperties properties = TestProperties.defaults();

    @Mock
    ChainDataGateway gateway;

    @Test
    void fillsMetadataFromAssetLookup() throws Exception {
        when(gateway.call(any(GatewayRequest.class))).thenReturn(new GatewayResult(GatewayResultStatus.SUCCESS, "helius",
                mapper.readTree("""
                        {"content":{"metadata":{"name":"Cadena Coin","symbol":"CDN"},"json_uri":"https://x.invalid/m.json"},
                         "token_info":{"decimals":6}}
                        """), 1, List.of("helius"), null, false));

        ChainEvent enriched = enricher().enrich(launch());

        assertEquals("Cadena Coin", enriched.tokenMetadata().name());
        assertEquals("CDN", enriched.tokenMetadata().symbol());
        assertEquals(6, enriched.tokenMetadata().decimals());
        assertEquals(MINT, enriched.tokenMetadata().mint());

        ArgumentCaptor<GatewayRequest> request = ArgumentCaptor.forClass(GatewayRequest.class);
        verify(gateway).call(request.capture());
        assertEquals(TokenMetadataEnricher.GET_ASSET, request.getValue().method());
        assertEquals(MINT, request.getValue().params().get("id").asText());
        assertEquals(VolatilityTier.FROZEN, request.getValue().tier());
        assertEquals(Set.of(Capability.ENHANCED_METADATA), request.getValue().capabilities());
    }

    @Test
    void degradedLookupLeavesEventUntouched() {
        when(gateway.call(any(GatewayRequest.class))).thenReturn(new GatewayResult(GatewayResultStatus.DEGRADED,
                GatewayResult.SYNTHETIC_PROVIDER, mapper.createObjectNode(), 0, List.of(), "no eligible provider", false));
        ChainEvent event = launch();

        assertSame(event, enricher().enrich(event));
    }

    @Test
    void plainTransfersAreNotLookedUp() {
        ChainEvent transfer = new ChainEvent("sig", 1L, "TRANSFER", null, null, null, null,
                null, null, null, null);

        assertSame(transfer, enricher().enrich(transfer));
        verifyNoInteractions(gateway);
    }

    @Test
    void assetWithoutNameOrSymbolYieldsNothing() throws Exception {
        assertEquals(Optional.empty(),
                TokenMetadataEnricher.toMetadata(MINT, mapper.readTree("{\"content\":{\"metadata\":{}}}")));
        assertNull(TokenMetadataEnricher.toMetadata(MINT,
                mapper.readTree("{\"content\":{\"metadata\":{\"symbol\":\"X\"}}}")).get().name());
    }

    private TokenMetadataEnricher enricher() {
        return new TokenMetadataEnricher(gateway, new TokenLaunches(properties), mapper, properties);
    }

    private static ChainEvent launch() {
        return new ChainEvent("sigLaunch", 1_700_000_000L, "CREATE", "PUMP_FUN", null, null, null,
                null, null,
                List.of(new ChainEvent.Instruction(AppProperties.Signals.PUMP_FUN_PROGRAM, List.of(MINT), "")),
                null);
    }
}
