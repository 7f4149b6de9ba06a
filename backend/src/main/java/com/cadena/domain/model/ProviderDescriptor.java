/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.domain.model;

import java.util.Set;

public record ProviderDescriptor(
        String id,
        String baseUrl,
        String apiKey,
        Set<Capability> capabilities,
        long monthlyQuota,
        double costPerRequest,
        Integer requestsPerMinute,
        int priority,
        int registrationOrder
) {
    public ProviderDescriptor {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("provider id is required");
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
        if (monthlyQuota < 0) throw new IllegalArgumentException("monthlyQuota must be >= 0");
        if (costPerRequest < 0) throw new IllegalArgumentException("costPerRequest must be >= 0");
    }

    public boolean supports(Set<Capability> required) {
        return required == null || capabilities.containsAll(required);
    }

    /** Peso efectivo para el round-robin ponderado. */
    public int effectivePriority() {
        return Math.max(1, priority);
    }

    @Override
    public String toString() {
        return "ProviderDescriptor[id=" + id + ", baseUrl=" + baseUrl + ", capabilities=" + capabilities
                + ", monthlyQuota=" + monthlyQuota + ", costPerRequest=" + costPerRequest
                + ", requestsPerMinute=" + requestsPerMinute + ", priority=" + priority + "]";
    }
}
