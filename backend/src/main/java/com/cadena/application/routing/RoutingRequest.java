/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.routing;

import com.cadena.domain.model.Capability;
import com.cadena.domain.model.RoutingPolicy;

import java.util.HashSet;
import java.util.Set;

public record RoutingRequest(
        Set<Capability> capabilities,
        String preferredProvider,
        Set<String> excludedProviders,
        RoutingPolicy policy
) {
    public RoutingRequest {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
        excludedProviders = excludedProviders == null ? Set.of() : Set.copyOf(excludedProviders);
        preferredProvider = preferredProvider == null || preferredProvider.isBlank() ? null : preferredProvider;
    }

    public static RoutingRequest any() {
        return new RoutingRequest(Set.of(), null, Set.of(), null);
    }

    public RoutingRequest excluding(Set<String> more) {
        Set<String> merged = new HashSet<>(excludedProviders);
        merged.addAll(more);
        return new RoutingRequest(capabilities, preferredProvider, merged, policy);
    }
}
