/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.routing;

import com.cadena.config.AppProperties;
import com.cadena.application.provider.ProviderRegistry;
import com.cadena.domain.model.Capability;
import com.cadena.domain.model.ProviderDescriptor;
import com.cadena.domain.model.RoutingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Chooses which provider serves a request.
 * <p>
 * A provider is eligible when its circuit is not OPEN, it has quota and per-minute capacity left, it offers
 * every requested capability and the caller did not exclude it. A preferred provider that is eligible wins
 * outright; otherwise the active {@link RoutingPolicy} orders the eligible set.
 */
@Service
public class RequestRouter {
    private static final Logger log = LoggerFactory.getLogger(RequestRouter.class);

    private static final Comparator<Candidate> BY_COST = Comparator
            .comparingDouble((Candidate c) -> c.provider().costPerRequest())
            .thenComparingDouble(c -> c.snapshot().averageLatencyMs())
            .thenComparingInt(c -> c.provider().registrationOrder());

    private static final Comparator<Candidate> BY_LATENCY = Comparator
            .comparingDouble((Candidate c) -> c.snapshot().averageLatencyMs())
            .thenComparing(Comparator.comparingDouble((Candidate c) -> c.snapshot().remainingQuotaFraction()).reversed())
            .thenComparingInt(c -> c.provider().registrationOrder());

    private static final Comparator<Candidate> ENHANCED_FIRST = Comparator
            .comparingInt((Candidate c) -> c.provider().capabilities().contains(Capability.ENHANCED_METADATA) ? 0 : 1)
            .thenComparing(BY_COST);

    private final ProviderRegistry registry;
    private final ProviderHealthReader healthReader;
    private final RoutingPolicy defaultPolicy;
    private final AtomicLong roundRobinPointer = new AtomicLong();
    private final AtomicLong weightedPointer = new AtomicLong();

    public RequestRouter(ProviderRegistry registry, ProviderHealthReader healthReader, AppProperties properties) {
        this.registry = registry;
        this.healthReader = healthReader;
        this.defaultPolicy = properties.routing().policy();
    }

    public RoutingPolicy defaultPolicy() {
        return defaultPolicy;
    }

    public ProviderDescriptor select(RoutingRequest request) {
        RoutingPolicy policy = effectivePolicy(request);
        List<Candidate> eligible = eligible(request);
        if (eligible.isEmpty()) {
            throw new ProviderUnavailableException("No eligible provider (excluded=" + request.excludedProviders()
                    + ", capabilities=" + request.capabilities() + ")");
        }

        if (request.preferredProvider() != null) {
            for (Candidate c : eligible) {
                if (c.provider().id().equals(request.preferredProvider())) {
                    return c.provider();
                }
            }
            log.debug("Preferred provider {} is not eligible, routing by {}", request.preferredProvider(), policy);
        }

        return switch (policy) {
            case ROUND_ROBIN -> roundRobin(eligible);
            case WEIGHTED_ROUND_ROBIN -> weightedRoundRobin(eligible);
            default -> order(eligible, policy).get(0).provider();
        };
    }

    public List<ProviderDescriptor> rank(RoutingRequest request) {
        RoutingPolicy policy = effectivePolicy(request);
        List<Candidate> eligible = eligible(request);
        List<ProviderDescriptor> ordered = new ArrayList<>(order(eligible, policy).stream().map(Candidate::provider).toList());
        if (request.preferredProvider() != null) {
            ordered.stream()
                    .filter(p -> p.id().equals(request.preferredProvider()))
                    .findFirst()
                    .ifPresent(preferred -> {
                        ordered.remove(preferred);
                        ordered.add(0, preferred);
                    });
        }
        return List.copyOf(ordered);
    }

    private RoutingPolicy effectivePolicy(RoutingRequest request) {
        return request.policy() == null ? defaultPolicy : request.policy();
    }

    private List<Candidate> eligible(RoutingRequest request) {
        List<Candidate> out = new ArrayList<>();
        for (ProviderDescriptor provider : registry.listProviders()) {
            if (request.excludedProviders().contains(provider.id())) continue;
            if (!provider.supports(request.capabilities())) continue;
            ProviderSnapshot snapshot = healthReader.getSnapshot(provider.id());
            if (!snapshot.routable()) continue;
            out.add(new Candidate(provider, snapshot));
        }
        return out;
    }

    private List<Candidate> order(List<Candidate> eligible, RoutingPolicy policy) {
        List<Candidate> sorted = new ArrayList<>(eligible);
        switch (policy) {
            case COST_OPTIMIZED -> sorted.sort(BY_COST);
            case PERFORMANCE_FIRST -> sorted.sort(BY_LATENCY);
            case ENHANCED_DATA_FIRST -> sorted.sort(ENHANCED_FIRST);
            case ROUND_ROBIN -> sorted.sort(Comparator.comparingInt(c -> c.provider().registrationOrder()));
            case WEIGHTED_ROUND_ROBIN -> sorted.sort(Comparator
                    .comparingInt((Candidate c) -> c.provider().effectivePriority()).reversed()
                    .thenComparingInt(c -> c.provider().registrationOrder()));
        }
        return sorted;
    }

    private ProviderDescriptor roundRobin(List<Candidate> eligible) {
        int index = (int) Math.floorMod(roundRobinPointer.getAndIncrement(), (long) eligible.size());
        return eligible.get(index).provider();
    }

    private ProviderDescriptor weightedRoundRobin(List<Candidate> eligible) {
        long total = 0;
        for (Candidate c : eligible) {
            total += c.provider().effectivePriority();
        }
        long slot = Math.floorMod(weightedPointer.getAndIncrement(), total);
        long cumulative = 0;
        for (Candidate c : eligible) {
            cumulative += c.provider().effectivePriority();
            if (slot < cumulative) {
                return c.provider();
            }
        }
        return eligible.get(eligible.size() - 1).provider();
    }

    private record Candidate(ProviderDescriptor provider, ProviderSnapshot snapshot) {}
}
