/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.resilience;

import com.cadena.application.gateway.GatewayRequest;
import com.cadena.application.gateway.GatewayResult;
import com.cadena.application.gateway.GatewayResultStatus;
import com.cadena.application.metrics.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs the failover cascade. Never throws: the caller always gets a {@link GatewayResult}.
 */
public class ResilientExecutor {
    private static final Logger log = LoggerFactory.getLogger(ResilientExecutor.class);

    private final List<ProviderCallStrategy> strategies;
    private final MetricsCollector metrics;

    public ResilientExecutor(List<ProviderCallStrategy> strategies, MetricsCollector metrics) {
        if (strategies.isEmpty()) throw new IllegalArgumentException("at least one strategy is required");
        this.strategies = List.copyOf(strategies);
        this.metrics = metrics;
    }

    public List<String> strategyNames() {
        return strategies.stream().map(ProviderCallStrategy::name).toList();
    }

    public GatewayResult execute(GatewayRequest request) {
        Set<String> excluded = new LinkedHashSet<>();
        List<String> tried = new ArrayList<>();
        int attempts = 0;
        String lastDetail = null;

        for (ProviderCallStrategy strategy : strategies) {
            CallOutcome outcome;
            try {
                outcome = strategy.attempt(request, Set.copyOf(excluded));
            } catch (RuntimeException e) {
                log.error("Strategy {} failed unexpectedly method={}", strategy.name(), request.method(), e);
                outcome = CallOutcome.noProvider("strategy " + strategy.name() + " failed");
            }
            attempts += outcome.attempts();
            if (outcome.providerId() != null && outcome.attempts() > 0) {
                tried.add(outcome.providerId());
            }

            if (outcome.status() == GatewayResultStatus.SUCCESS) {
                return new GatewayResult(GatewayResultStatus.SUCCESS, outcome.providerId(), outcome.payload(),
                        attempts, tried, null, false);
            }
            if (outcome.status() == GatewayResultStatus.DEGRADED) {
                metrics.degradedResult();
                log.warn("Serving degraded result method={} tried={} reason={}", request.method(), tried, outcome.detail());
                return new GatewayResult(GatewayResultStatus.DEGRADED, outcome.providerId(), outcome.payload(),
                        attempts, tried, outcome.detail(), false);
            }

            lastDetail = outcome.detail();
            if (outcome.providerId() != null) {
                excluded.add(outcome.providerId());
                log.warn("Failover after strategy={} provider={} method={} reason={}",
                        strategy.name(), outcome.providerId(), request.method(), lastDetail);
            }
        }

        log.error("Gateway call failed with no fallback method={} tried={} reason={}", request.method(), tried, lastDetail);
        return new GatewayResult(GatewayResultStatus.ERROR, null, null, attempts, tried,
                lastDetail == null ? "no provider answered" : lastDetail, false);
    }
}
