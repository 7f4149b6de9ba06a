/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.api.providers;

import com.cadena.api.ApiException;
import com.cadena.application.provider.ProviderRegistry;
import com.cadena.application.provider.UsageTracker;
import com.cadena.application.routing.ProviderHealthService;
import com.cadena.application.routing.ProviderSnapshot;
import com.cadena.application.routing.RequestRouter;
import com.cadena.application.routing.RoutingRequest;
import com.cadena.domain.model.ProviderDescriptor;
import com.cadena.domain.model.RoutingPolicy;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.Set;

@RestController
@RequestMapping("/api/providers")
public class ProviderStatusController {
    private final ProviderRegistry registry;
    private final ProviderHealthService healthService;
    private final UsageTracker usageTracker;
    private final RequestRouter router;

    public ProviderStatusController(
            ProviderRegistry registry,
            ProviderHealthService healthService,
            UsageTracker usageTracker,
            RequestRouter router
    ) {
        this.registry = registry;
        this.healthService = healthService;
        this.usageTracker = usageTracker;
        this.router = router;
    }

    /**
     * Estado de cada proveedor y el orden en que se elegirían ahora mismo.
     */
    @GetMapping
    public ProviderStatusResponse list(@RequestParam(value = "policy", required = false) String policyParam) {
        RoutingPolicy policy = parsePolicy(policyParam);
        List<String> ranking = router.rank(new RoutingRequest(Set.of(), null, Set.of(), policy)).stream()
                .map(ProviderDescriptor::id)
                .toList();

        List<ProviderStatusResponse.ProviderStatus> providers = registry.listProviders().stream()
                .map(p -> {
                    ProviderSnapshot s = healthService.getSnapshot(p.id());
                    return new ProviderStatusResponse.ProviderStatus(
                            p.id(),
                            p.capabilities(),
                            p.costPerRequest(),
                            p.priority(),
                            s.circuitState(),
                            s.health(),
                            s.averageLatencyMs(),
                            s.successRate(),
                            s.consecutiveFailures(),
                            s.lastFailureAt(),
                            usageTracker.usage(p.id())
                    );
                })
                .toList();
        return new ProviderStatusResponse(policy, ranking, providers);
    }

    private RoutingPolicy parsePolicy(String value) {
        if (value == null || value.isBlank()) {
            return router.defaultPolicy();
        }
        try {
            return RoutingPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "Unknown routing policy: " + value);
        }
    }
}
