/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.api.gateway;

import com.cadena.application.gateway.ChainDataGateway;
import com.cadena.application.gateway.GatewayResult;
import com.cadena.application.gateway.GatewayResultStatus;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Internal access to the gateway. Degraded answers are still 200; only a cascade with no answer at all is 502.
 */
@RestController
@RequestMapping("/api/gateway")
public class GatewayController {
    private final ChainDataGateway gateway;

    public GatewayController(ChainDataGateway gateway) {
        this.gateway = gateway;
    }

    @PostMapping(value = "/rpc", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<GatewayResult> rpc(@Valid @RequestBody GatewayRpcRequest request) {
        GatewayResult result = gateway.call(request.toGatewayRequest());
        HttpStatus status = result.status() == GatewayResultStatus.ERROR ? HttpStatus.BAD_GATEWAY : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }
}
