/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.config;

import com.cadena.application.provider.QuotaPeriod;
import com.cadena.domain.model.RoutingPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "app")
public record AppProperties(
        Routing routing,
        List<ProviderConfig> providers,
        Quota quota,
        CircuitBreaker circuitBreaker,
        Retry retry,
        Cache cache,
        Webhook webhook,
        Signals signals,
        Dispatch dispatch,
        Ingestion ingestion,
        HealthCheck healthCheck
) {
    public AppProperties {
        routing = routing == null ? new Routing(null, null, null) : routing;
        providers = providers == null ? List.of() : List.copyOf(providers);
        quota = quota == null ? new Quota(null, null, null) : quota;
        circuitBreaker = circuitBreaker == null ? new CircuitBreaker(null, null) : circuitBreaker;
        retry = retry == null ? new Retry(null, null, null, null, null) : retry;
        cache = cache == null ? new Cache(null, null, null, null, null) : cache;
        webhook = webhook == null ? new Webhook(null, null, null, null, null) : webhook;
        signals = signals == null ? new Signals(null, null, null, null, null, null) : signals;
        dispatch = dispatch == null ? new Dispatch(null, null) : dispatch;
        ingestion = ingestion == null ? new Ingestion(null) : ingestion;
        healthCheck = healthCheck == null ? new HealthCheck(null, null) : healthCheck;
    }

    public record Routing(RoutingPolicy policy, Integer cascadeDepth, Boolean syntheticFallback) {
        public Routing {
            policy = policy == null ? RoutingPolicy.COST_OPTIMIZED : policy;
            cascadeDepth = cascadeDepth == null || cascadeDepth < 1 ? 2 : cascadeDepth;
            syntheticFallback = syntheticFallback == null || syntheticFallback;
        }
    }

    public record ProviderConfig(
            String id,
            String baseUrl,
            String apiKey,
            Long monthlyQuota,
            Double costPerRequest,
            Integer requestsPerMinute,
            Integer priority,
            Boolean enhancedMetadata,
            Boolean pushNotifications
    ) {
        public ProviderConfig {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("app.providers[].id is required");
            }
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new IllegalArgumentException("app.providers[" + id + "].base-url is required");
            }
            monthlyQuota = monthlyQuota == null ? Long.MAX_VALUE : monthlyQuota;
            costPerRequest = costPerRequest == null ? 0.0 : costPerRequest;
            priority = priority == null ? 1 : priority;
            enhancedMetadata = enhancedMetadata != null && enhancedMetadata;
            pushNotifications = pushNotifications != null && pushNotifications;
        }
    }

    public record Quota(QuotaPeriod resetPolicy, Double alertThreshold, Duration alertInterval) {
        public Quota {
            resetPolicy = resetPolicy == null ? QuotaPeriod.CALENDAR_MONTH_UTC : resetPolicy;
            alertThreshold = alertThreshold == null ? 0.8 : alertThreshold;
            alertInterval = alertInterval == null ? Duration.ofHours(1) : alertInterval;
        }
    }

    public record CircuitBreaker(Integer failureThreshold, Duration cooldown) {
        public CircuitBreaker {
            failureThreshold = failureThreshold == null || failureThreshold < 1 ? 5 : failureThreshold;
            cooldown = cooldown == null ? Duration.ofSeconds(30) : cooldown;
        }
    }

    public record Retry(Integer maxRetries, Duration baseDelay, Duration maxDelay, Double jitter, Duration callTimeout) {
        public Retry {
            maxRetries = maxRetries == null || maxRetries < 0 ? 3 : maxRetries;
            baseDelay = baseDelay == null ? Duration.ofMillis(100) : baseDelay;
            maxDelay = maxDelay == null ? Duration.ofSeconds(5) : maxDelay;
            jitter = jitter == null ? 0.25 : jitter;
            callTimeout = callTimeout == null ? Duration.ofSeconds(2) : callTimeout;
        }
    }

    public record Cache(Long maxSize, Duration hotTtl, Duration warmTtl, Duration coldTtl, Duration frozenTtl) {
        public Cache {
            maxSize = maxSize == null || maxSize < 1 ? 10_000L : maxSize;
            hotTtl = hotTtl == null ? Duration.ofMinutes(1) : hotTtl;
            warmTtl = warmTtl == null ? Duration.ofMinutes(5) : warmTtl;
            coldTtl = coldTtl == null ? Duration.ofMinutes(10) : coldTtl;
            frozenTtl = frozenTtl == null ? Duration.ofHours(1) : frozenTtl;
        }
    }

    public record Webhook(
            String secret,
            RateLimit rateLimit,
            Duration dedupWindow,
            Long dedupMaxEntries,
            Integer maxEventsPerPayload
    ) {
        public Webhook {
            rateLimit = rateLimit == null ? new RateLimit(null, null) : rateLimit;
            dedupWindow = dedupWindow == null ? Duration.ofMinutes(10) : dedupWindow;
            dedupMaxEntries = dedupMaxEntries == null ? 100_000L : dedupMaxEntries;
            maxEventsPerPayload = maxEventsPerPayload == null ? 500 : maxEventsPerPayload;
        }

        public record RateLimit(Integer requests, Duration window) {
            public RateLimit {
                requests = requests == null || requests < 1 ? 100 : requests;
                window = window == null ? Duration.ofMinutes(1) : window;
            }
        }
    }

    public record Signals(
            BigDecimal largeVolumeUsdThreshold,
            BigDecimal referenceCeilingUsd,
            List<String> newListingPrograms,
            BigDecimal solUsdPrice,
            Map<String, BigDecimal> tokenUsdPrices,
            LaunchRisk launchRisk
    ) {
        public static final String PUMP_FUN_PROGRAM = "6EF8rrecthR5Dkzon8Nwu78hRvfCKubJ14M5uBEwF6P";
        public static final String USDC_MINT = "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v";
        public static final String USDT_MINT = "Es9vMFrzaCERmJfrF4H2FYD4KCoNkY11McCe8BenwNYB";

        public Signals {
            largeVolumeUsdThreshold = largeVolumeUsdThreshold == null ? new BigDecimal("1000") : largeVolumeUsdThreshold;
            referenceCeilingUsd = referenceCeilingUsd == null ? new BigDecimal("100000") : referenceCeilingUsd;
            newListingPrograms = newListingPrograms == null || newListingPrograms.isEmpty()
                    ? List.of(PUMP_FUN_PROGRAM)
                    : List.copyOf(newListingPrograms);
            solUsdPrice = solUsdPrice == null ? new BigDecimal("150") : solUsdPrice;
            tokenUsdPrices = tokenUsdPrices == null || tokenUsdPrices.isEmpty()
                    ? Map.of(USDC_MINT, BigDecimal.ONE, USDT_MINT, BigDecimal.ONE)
                    : Map.copyOf(tokenUsdPrices);
            launchRisk = launchRisk == null ? new LaunchRisk(null, null, null, null) : launchRisk;
        }

        public record LaunchRisk(
                Long highFeeLamports,
                BigDecimal largeMintAmount,
                BigDecimal minLiquiditySol,
                Integer minHolders
        ) {
            public LaunchRisk {
                highFeeLamports = highFeeLamports == null ? 100_000L : highFeeLamports;
                largeMintAmount = largeMintAmount == null ? new BigDecimal("1000000000") : largeMintAmount;
                minLiquiditySol = minLiquiditySol == null ? BigDecimal.ONE : minLiquiditySol;
                minHolders = minHolders == null ? 10 : minHolders;
            }
        }
    }

    public record Dispatch(List<Target> targets, Duration deadline) {
        public Dispatch {
            targets = targets == null ? List.of() : List.copyOf(targets);
            deadline = deadline == null ? Duration.ofSeconds(15) : deadline;
        }

        public record Target(String id, String url, Duration timeout) {
            public Target {
                if (id == null || id.isBlank()) throw new IllegalArgumentException("app.dispatch.targets[].id is required");
                if (url == null || url.isBlank()) throw new IllegalArgumentException("app.dispatch.targets[" + id + "].url is required");
                timeout = timeout == null ? Duration.ofSeconds(5) : timeout;
            }
        }
    }

    public record Ingestion(Boolean enrichTokenMetadata) {
        public Ingestion {
            enrichTokenMetadata = enrichTokenMetadata == null || enrichTokenMetadata;
        }
    }

    public record HealthCheck(Boolean enabled, Duration timeout) {
        public HealthCheck {
            enabled = enabled == null || enabled;
            timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
        }
    }
}
