/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.support;

import com.cadena.config.AppProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Fluent construction of {@link AppProperties} for unit tests; unset sections take their defaults.
 */
public final class TestProperties {
    private AppProperties.Routing routing;
    private final List<AppProperties.ProviderConfig> providers = new ArrayList<>();
    private AppProperties.Quota quota;
    private AppProperties.CircuitBreaker circuitBreaker;
    private AppProperties.Retry retry;
    private AppProperties.Cache cache;
    private AppProperties.Webhook webhook;
    private AppProperties.Signals signals;
    private AppProperties.Dispatch dispatch;
    private AppProperties.Ingestion ingestion;
    private AppProperties.HealthCheck healthCheck;

    public static TestProperties builder() {
        return new TestProperties();
    }

    public static AppProperties defaults() {
        return builder().build();
    }

    public static AppProperties.ProviderConfig provider(String id, long monthlyQuota, double cost) {
        return new AppProperties.ProviderConfig(id, "http://" + id + ".invalid", null, monthlyQuota, cost,
                null, 1, false, false);
    }

    public TestProperties routing(AppProperties.Routing routing) {
        this.routing = routing;
        return this;
    }

    public TestProperties provider(AppProperties.ProviderConfig provider) {
        this.providers.add(provider);
        return this;
    }

    public TestProperties quota(AppProperties.Quota quota) {
        this.quota = quota;
        return this;
    }

    public TestProperties circuitBreaker(AppProperties.CircuitBreaker circuitBreaker) {
        this.circuitBreaker = circuitBreaker;
        return this;
    }

    public TestProperties retry(AppProperties.Retry retry) {
        this.retry = retry;
        return this;
    }

    public TestProperties cache(AppProperties.Cache cache) {
        this.cache = cache;
        return this;
    }

    public TestProperties webhook(AppProperties.Webhook webhook) {
        this.webhook = webhook;
        return this;
    }

    public TestProperties signals(AppProperties.Signals signals) {
        this.signals = signals;
        return this;
    }

    public TestProperties dispatch(AppProperties.Dispatch dispatch) {
        this.dispatch = dispatch;
        return this;
    }

    public TestProperties ingestion(AppProperties.Ingestion ingestion) {
        this.ingestion = ingestion;
        return this;
    }

    public TestProperties healthCheck(AppProperties.HealthCheck healthCheck) {
        this.healthCheck = healthCheck;
        return this;
    }

    public AppProperties build() {
        return new AppProperties(routing, providers, quota, circuitBreaker, retry, cache, webhook, signals, dispatch,
                ingestion, healthCheck);
    }
}
