/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.config;

import com.cadena.application.cache.TieredResponseCache;
import com.cadena.application.gateway.GatewayResult;
import com.cadena.application.metrics.MetricsCollector;
import com.cadena.application.provider.ProviderRegistry;
import com.cadena.application.provider.UsageTracker;
import com.cadena.application.resilience.CircuitBreakerRegistry;
import com.cadena.application.resilience.ProviderCallStrategy;
import com.cadena.application.resilience.ResilientExecutor;
import com.cadena.application.resilience.RetryPolicy;
import com.cadena.application.resilience.RoutedProviderStrategy;
import com.cadena.application.resilience.Sleeper;
import com.cadena.application.resilience.SyntheticFallbackStrategy;
import com.cadena.application.routing.RequestRouter;
import com.cadena.infrastructure.provider.ProviderTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Configuration
public class GatewayConfig {
    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return Sleeper.threadSleeper();
    }

    @Bean
    public TieredResponseCache<GatewayResult> responseCache(AppProperties properties, MetricsCollector metrics, Clock clock) {
        return new TieredResponseCache<>(properties.cache(), GatewayResult::detached, metrics, clock);
    }

    @Bean
    public ResilientExecutor resilientExecutor(
            AppProperties properties,
            RequestRouter router,
            CircuitBreakerRegistry breakers,
            UsageTracker usageTracker,
            ProviderRegistry registry,
            ProviderTransport transport,
            Sleeper sleeper,
            MetricsCollector metrics,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        RetryPolicy retryPolicy = RetryPolicy.from(properties.retry());
        List<ProviderCallStrategy> strategies = new ArrayList<>();
        int hops = properties.routing().cascadeDepth();
        for (int i = 0; i < hops; i++) {
            String name = i == 0 ? "primary" : "fallback-" + i;
            strategies.add(new RoutedProviderStrategy(
                    name, router, breakers, usageTracker, registry, transport,
                    retryPolicy, sleeper, metrics, clock, properties.retry().callTimeout()));
        }
        if (properties.routing().syntheticFallback()) {
            strategies.add(new SyntheticFallbackStrategy(objectMapper));
        }
        ResilientExecutor executor = new ResilientExecutor(strategies, metrics);
        log.info("Gateway cascade: {} (policy={})", executor.strategyNames(), properties.routing().policy());
        return executor;
    }
}
