/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.metrics;

import com.cadena.application.provider.ProviderUsage;
import com.cadena.application.provider.UsageTracker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.distribution.HistogramSnapshot;
import io.micrometer.core.instrument.distribution.ValueAtPercentile;
import io.micrometer.core.instrument.search.Search;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

@Component
public class MetricsCollector {
    static final String WEBHOOK_EVENTS = "cadena.webhook.events";
    static final String WEBHOOK_REJECTIONS = "cadena.webhook.rejections";
    static final String WEBHOOK_PROCESSING = "cadena.webhook.processing";
    static final String PROVIDER_REQUESTS = "cadena.provider.requests";
    static final String PROVIDER_LATENCY = "cadena.provider.latency";
    static final String CACHE_REQUESTS = "cadena.cache.requests";
    static final String DISPATCH = "cadena.dispatch";
    static final String DISPATCH_LATENCY = "cadena.dispatch.latency";
    static final String DEGRADED = "cadena.gateway.degraded";

    private static final String SUCCESS = "success";

    private final MeterRegistry registry;
    private final UsageTracker usageTracker;
    private final Clock clock;
    private final Timer webhookTimer;
    private final Timer providerTimer;
    private final Timer dispatchTimer;

    public MetricsCollector(MeterRegistry registry, UsageTracker usageTracker, Clock clock) {
        this.registry = registry;
        this.usageTracker = usageTracker;
        this.clock = clock;
        this.webhookTimer = timer(WEBHOOK_PROCESSING);
        this.providerTimer = timer(PROVIDER_LATENCY);
        this.dispatchTimer = timer(DISPATCH_LATENCY);
    }

    public void webhookEvents(String outcome, int count) {
        if (count <= 0) return;
        registry.counter(WEBHOOK_EVENTS, "outcome", outcome).increment(count);
    }

    public void webhookRejected(String reason) {
        registry.counter(WEBHOOK_REJECTIONS, "reason", reason).increment();
    }

    public void webhookProcessed(long latencyMs) {
        webhookTimer.record(latencyMs, TimeUnit.MILLISECONDS);
    }

    public void providerCall(String providerId, String outcome, long latencyMs) {
        registry.counter(PROVIDER_REQUESTS, "provider", providerId, "outcome", outcome).increment();
        providerTimer.record(latencyMs, TimeUnit.MILLISECONDS);
    }

    public void cacheHit() {
        registry.counter(CACHE_REQUESTS, "result", "hit").increment();
    }

    public void cacheMiss() {
        registry.counter(CACHE_REQUESTS, "result", "miss").increment();
    }

    public void dispatch(String targetId, String outcome, long latencyMs) {
        registry.counter(DISPATCH, "target", targetId, "outcome", outcome).increment();
        dispatchTimer.record(latencyMs, TimeUnit.MILLISECONDS);
    }

    public void degradedResult() {
        registry.counter(DEGRADED).increment();
    }

    public MetricsSnapshot snapshot() {
        Map<String, Long> rejections = new LinkedHashMap<>();
        for (Counter c : Search.in(registry).name(WEBHOOK_REJECTIONS).counters()) {
            rejections.merge(c.getId().getTag("reason"), (long) c.count(), Long::sum);
        }
        MetricsSnapshot.Webhooks webhooks = new MetricsSnapshot.Webhooks(
                count(WEBHOOK_EVENTS, "outcome", "received"),
                count(WEBHOOK_EVENTS, "outcome", "succeeded"),
                count(WEBHOOK_EVENTS, "outcome", "failed"),
                rejections
        );

        List<MetricsSnapshot.ProviderMetrics> providers = new ArrayList<>();
        for (ProviderUsage usage : usageTracker.snapshot()) {
            long total = sum(Search.in(registry).name(PROVIDER_REQUESTS).tag("provider", usage.providerId()));
            long ok = count(PROVIDER_REQUESTS, "provider", usage.providerId(), "outcome", SUCCESS);
            providers.add(new MetricsSnapshot.ProviderMetrics(
                    usage.providerId(),
                    total,
                    total - ok,
                    usage.used(),
                    usage.quota(),
                    usage.costThisPeriod(),
                    usage.projectedRequests(),
                    usage.projectedCost()
            ));
        }

        long hits = count(CACHE_REQUESTS, "result", "hit");
        long misses = count(CACHE_REQUESTS, "result", "miss");
        double hitRate = hits + misses == 0 ? 0.0 : (double) hits / (hits + misses);

        Map<String, MetricsSnapshot.Latency> latency = new LinkedHashMap<>();
        latency.put("webhook", latency(webhookTimer));
        latency.put("provider", latency(providerTimer));
        latency.put("dispatch", latency(dispatchTimer));

        MetricsSnapshot.Dispatch dispatch = new MetricsSnapshot.Dispatch(
                sum(Search.in(registry).name(DISPATCH).tag("outcome", SUCCESS)),
                sum(Search.in(registry).name(DISPATCH).tag("outcome", "failure")),
                sum(Search.in(registry).name(DISPATCH).tag("outcome", "timeout"))
        );

        return new MetricsSnapshot(
                clock.instant(),
                webhooks,
                providers,
                new MetricsSnapshot.Cache(hits, misses, hitRate),
                latency,
                dispatch,
                count(DEGRADED)
        );
    }

    private Timer timer(String name) {
        return Timer.builder(name)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    private long count(String name, String... tags) {
        Counter counter = registry.find(name).tags(tags).counter();
        return counter == null ? 0 : (long) counter.count();
    }

    private static long sum(Search search) {
        long total = 0;
        for (Counter c : search.counters()) {
            total += (long) c.count();
        }
        return total;
    }

    private static MetricsSnapshot.Latency latency(Timer timer) {
        HistogramSnapshot snapshot = timer.takeSnapshot();
        double p50 = 0;
        double p95 = 0;
        double p99 = 0;
        for (ValueAtPercentile v : snapshot.percentileValues()) {
            double ms = v.value(TimeUnit.MILLISECONDS);
            if (v.percentile() == 0.5) p50 = ms;
            else if (v.percentile() == 0.95) p95 = ms;
            else if (v.percentile() == 0.99) p99 = ms;
        }
        return new MetricsSnapshot.Latency(snapshot.count(), p50, p95, p99);
    }
}
