/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.provider;

import com.cadena.config.AppProperties;
import com.cadena.domain.model.Capability;
import com.cadena.domain.model.ProviderDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class ProviderRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final List<ProviderDescriptor> providers;
    private final Map<String, ProviderRuntimeStats> stats;

    @Autowired
    public ProviderRegistry(AppProperties properties) {
        this(toDescriptors(properties.providers()));
    }

    private ProviderRegistry(List<ProviderDescriptor> descriptors) {
        Map<String, ProviderRuntimeStats> byId = new LinkedHashMap<>();
        for (ProviderDescriptor descriptor : descriptors) {
            if (byId.putIfAbsent(descriptor.id(), new ProviderRuntimeStats()) != null) {
                throw new IllegalStateException("Duplicate provider id: " + descriptor.id());
            }
        }
        this.providers = List.copyOf(descriptors);
        this.stats = Map.copyOf(byId);
        if (providers.isEmpty()) {
            log.warn("No providers configured; every gateway call will use the synthetic fallback");
        } else {
            log.info("Registered providers: {}", providers.stream().map(ProviderDescriptor::id).toList());
        }
    }

    public static ProviderRegistry of(List<ProviderDescriptor> descriptors) {
        return new ProviderRegistry(descriptors);
    }

    public List<ProviderDescriptor> listProviders() {
        return providers;
    }

    public Optional<ProviderDescriptor> find(String id) {
        if (id == null) return Optional.empty();
        return providers.stream().filter(p -> p.id().equals(id)).findFirst();
    }

    public ProviderRuntimeStats stats(String id) {
        ProviderRuntimeStats s = stats.get(id);
        if (s == null) {
            throw new IllegalArgumentException("Unknown provider: " + id);
        }
        return s;
    }

    public void recordOutcome(String id, boolean success, long latencyMs, Instant at) {
        stats(id).record(success, latencyMs, at);
    }

    static List<ProviderDescriptor> toDescriptors(List<AppProperties.ProviderConfig> configs) {
        List<ProviderDescriptor> out = new ArrayList<>();
        int order = 0;
        for (AppProperties.ProviderConfig cfg : configs) {
            EnumSet<Capability> capabilities = EnumSet.noneOf(Capability.class);
            if (cfg.enhancedMetadata()) capabilities.add(Capability.ENHANCED_METADATA);
            if (cfg.pushNotifications()) capabilities.add(Capability.PUSH_NOTIFICATIONS);
            out.add(new ProviderDescriptor(
                    cfg.id(),
                    cfg.baseUrl(),
                    cfg.apiKey(),
                    capabilities,
                    cfg.monthlyQuota(),
                    cfg.costPerRequest(),
                    cfg.requestsPerMinute(),
                    cfg.priority(),
                    order++
            ));
        }
        return out;
    }
}
