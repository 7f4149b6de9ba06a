/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.ingestion;

import com.cadena.application.gateway.ChainDataGateway;
import com.cadena.application.gateway.GatewayRequest;
import com.cadena.application.gateway.GatewayResult;
import com.cadena.application.signals.TokenLaunches;
import com.cadena.config.AppProperties;
import com.cadena.domain.model.Capability;
import com.cadena.domain.model.ChainEvent;
import com.cadena.domain.model.VolatilityTier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

@Component
public class TokenMetadataEnricher {
    private static final Logger log = LoggerFactory.getLogger(TokenMetadataEnricher.class);
    static final String GET_ASSET = "getAsset";

    private final ChainDataGateway gateway;
    private final TokenLaunches launches;
    private final ObjectMapper objectMapper;
    private final boolean enabled;

    public TokenMetadataEnricher(
            ChainDataGateway gateway,
            TokenLaunches launches,
            ObjectMapper objectMapper,
            AppProperties properties
    ) {
        this.gateway = gateway;
        this.launches = launches;
        this.objectMapper = objectMapper;
        this.enabled = properties.ingestion().enrichTokenMetadata();
    }

    public ChainEvent enrich(ChainEvent event) {
        if (!enabled || !launches.isLaunch(event)) {
            return event;
        }
        if (event.tokenMetadata() != null && event.tokenMetadata().isComplete()) {
            return event;
        }
        Optional<String> mint = launches.launchedMint(event);
        if (mint.isEmpty()) {
            return event;
        }

        ObjectNode params = objectMapper.createObjectNode().put("id", mint.get());
        GatewayResult result = gateway.call(new GatewayRequest(
                GET_ASSET,
                params,
                VolatilityTier.FROZEN,
                Set.of(Capability.ENHANCED_METADATA),
                null,
                null
        ));
        if (!result.isSuccess() || result.payload() == null) {
            log.debug("Token metadata unavailable mint={} status={}", mint.get(), result.status());
            return event;
        }
        return toMetadata(mint.get(), result.payload())
                .map(event::withTokenMetadata)
                .orElse(event);
    }

    static Optional<ChainEvent.TokenMetadata> toMetadata(String mint, JsonNode asset) {
        JsonNode content = asset.path("content");
        String name = text(content.path("metadata").path("name"));
        String symbol = text(content.path("metadata").path("symbol"));
        if (name == null && symbol == null) {
            return Optional.empty();
        }
        JsonNode decimalsNode = asset.path("token_info").path("decimals");
        Integer decimals = decimalsNode.isInt() ? decimalsNode.asInt() : null;
        return Optional.of(new ChainEvent.TokenMetadata(mint, name, symbol, decimals, text(content.path("json_uri"))));
    }

    private static String text(JsonNode node) {
        if (!node.isTextual() || node.asText().isBlank()) return null;
        return node.asText();
    }
}
