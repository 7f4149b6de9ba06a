/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.resilience;

import com.cadena.application.gateway.GatewayRequest;

import java.util.Set;

public interface ProviderCallStrategy {
    String name();

    CallOutcome attempt(GatewayRequest request, Set<String> excluded);
}
