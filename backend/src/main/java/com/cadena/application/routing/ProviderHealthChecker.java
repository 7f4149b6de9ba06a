/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.routing;

import com.cadena.application.provider.ProviderRegistry;
import com.cadena.application.resilience.CircuitBreaker;
import com.cadena.application.resilience.CircuitBreakerRegistry;
import com.cadena.config.AppProperties;
import com.cadena.domain.model.ProviderDescriptor;
import com.cadena.infrastructure.provider.ProviderException;
import com.cadena.infrastructure.provider.ProviderTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Periodic {@code getHealth} call against every provider.
 * <p>
 * Results feed the runtime stats. A provider whose breaker cooldown has elapsed is closed again by a passing
 * check; a failing check counts as a breaker failure. Providers inside their cooldown are skipped. Checks are
 * not charged against the quota.
 */
@Component
@ConditionalOnProperty(prefix = "app.health-check", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ProviderHealthChecker {
    private static final Logger log = LoggerFactory.getLogger(ProviderHealthChecker.class);
    static final String HEALTH_METHOD = "getHealth";

    private final ProviderRegistry registry;
    private final CircuitBreakerRegistry breakers;
    private final ProviderTransport transport;
    private final Duration timeout;
    private final Clock clock;

    public ProviderHealthChecker(
            ProviderRegistry registry,
            CircuitBreakerRegistry breakers,
            ProviderTransport transport,
            AppProperties properties,
            Clock clock
    ) {
        this.registry = registry;
        this.breakers = breakers;
        this.transport = transport;
        this.timeout = properties.healthCheck().timeout();
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.health-check.interval-ms:60000}", initialDelayString = "${app.health-check.interval-ms:60000}")
    public void checkAll() {
        for (ProviderDescriptor provider : registry.listProviders()) {
            check(provider);
        }
    }

    public boolean check(ProviderDescriptor provider) {
        String id = provider.id();
        CircuitBreaker breaker = breakers.forProvider(id);
        CircuitBreaker.Permit permit = breaker.acquire(clock.instant());
        if (permit == CircuitBreaker.Permit.DENIED) {
            log.debug("Health check skipped provider={} circuit={}", id, breaker.state(clock.instant()));
            return false;
        }
        long started = System.nanoTime();
        try {
            transport.call(provider, HEALTH_METHOD, null, timeout);
            long latencyMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
            registry.recordOutcome(id, true, latencyMs, clock.instant());
            if (permit == CircuitBreaker.Permit.TRIAL) {
                breaker.onSuccess();
                log.info("Circuit closed by health check provider={}", id);
            }
            log.debug("Health check passed provider={} latencyMs={}", id, latencyMs);
            return true;
        } catch (RuntimeException e) {
            long latencyMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
            Instant now = clock.instant();
            registry.recordOutcome(id, false, latencyMs, now);
            breaker.onFailure(now);
            String error = e instanceof ProviderException pe ? pe.getType() + " " + pe.getSafeMessage() : e.toString();
            log.warn("Health check failed provider={} error={}", id, error);
            return false;
        }
    }
}
