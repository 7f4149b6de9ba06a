/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.infrastructure.provider;

import com.cadena.domain.model.ProviderDescriptor;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;

public interface ProviderTransport {

    /**
     * @return the {@code result} member of the JSON-RPC response
     * @throws ProviderException on timeout, transport failure, non-2xx status or a JSON-RPC {@code error}
     */
    JsonNode call(ProviderDescriptor provider, String method, JsonNode params, Duration timeout);
}
