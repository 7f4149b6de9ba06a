/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.provider;

import com.cadena.config.AppProperties;
import com.cadena.config.ClockTimeMeter;
import com.cadena.domain.model.ProviderDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Monthly quota, cost and requests-per-minute accounting per provider.
 * Quota checks fail closed: a request that would exceed the quota is refused without touching the counter.
 */
@Service
public class UsageTracker {
    private static final Logger log = LoggerFactory.getLogger(UsageTracker.class);

    private final Map<String, UsageCounter> counters;
    private final Clock clock;
    private final double alertThreshold;
    private final Duration alertInterval;

    public UsageTracker(ProviderRegistry registry, AppProperties properties, Clock clock) {
        this.clock = clock;
        AppProperties.Quota quota = properties.quota();
        this.alertThreshold = quota.alertThreshold();
        this.alertInterval = quota.alertInterval();
        Instant now = clock.instant();
        ClockTimeMeter timeMeter = new ClockTimeMeter(clock);
        Map<String, UsageCounter> byId = new LinkedHashMap<>();
        for (ProviderDescriptor provider : registry.listProviders()) {
            byId.put(provider.id(), new UsageCounter(provider, quota.resetPolicy(), now, timeMeter));
        }
        this.counters = Map.copyOf(byId);
    }

    public UsageDecision recordUsage(String providerId, double cost) {
        UsageCounter counter = counter(providerId);
        Instant now = clock.instant();
        UsageDecision decision = counter.reserve(cost, now);
        if (decision.accepted() && counter.claimAlert(alertThreshold, alertInterval, now)) {
            ProviderUsage usage = counter.snapshot(now);
            log.warn("Provider usage alert provider={} used={} quota={} usedFraction={} projectedRequests={}",
                    providerId, usage.used(), usage.quota(),
                    String.format("%.2f", usage.usedFraction()), usage.projectedRequests());
        }
        return decision;
    }

    public void refund(String providerId, double cost, Instant reservedAt) {
        counter(providerId).refund(cost, reservedAt, clock.instant());
    }

    public void refund(String providerId, double cost) {
        Instant now = clock.instant();
        counter(providerId).refund(cost, now, now);
    }

    public boolean isOverQuota(String providerId) {
        return counter(providerId).isOverQuota(clock.instant());
    }

    public boolean isRateLimited(String providerId) {
        return counter(providerId).isRateLimited();
    }

    public ProviderUsage usage(String providerId) {
        return counter(providerId).snapshot(clock.instant());
    }

    public List<ProviderUsage> snapshot() {
        Instant now = clock.instant();
        return counters.values().stream().map(c -> c.snapshot(now)).toList();
    }

    @Scheduled(fixedRateString = "${app.quota.sweep-interval-ms:3600000}")
    public void rollPeriods() {
        Instant now = clock.instant();
        counters.forEach((id, counter) -> {
            if (counter.roll(now)) {
                log.info("Quota period reset provider={} at={}", id, now);
            }
        });
    }

    private UsageCounter counter(String providerId) {
        UsageCounter counter = counters.get(providerId);
        if (counter == null) {
            throw new IllegalArgumentException("Unknown provider: " + providerId);
        }
        return counter;
    }
}
