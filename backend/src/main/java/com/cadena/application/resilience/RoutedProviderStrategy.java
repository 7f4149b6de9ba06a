/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.resilience;

import com.cadena.application.gateway.GatewayRequest;
import com.cadena.application.metrics.MetricsCollector;
import com.cadena.application.provider.ProviderRegistry;
import com.cadena.application.provider.UsageDecision;
import com.cadena.application.provider.UsageTracker;
import com.cadena.application.routing.ProviderUnavailableException;
import com.cadena.application.routing.RequestRouter;
import com.cadena.application.routing.RoutingRequest;
import com.cadena.domain.model.CircuitState;
import com.cadena.domain.model.ProviderDescriptor;
import com.cadena.infrastructure.provider.ProviderErrorType;
import com.cadena.infrastructure.provider.ProviderException;
import com.cadena.infrastructure.provider.ProviderTransport;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Set;

public class RoutedProviderStrategy implements ProviderCallStrategy {
    private static final Logger log = LoggerFactory.getLogger(RoutedProviderStrategy.class);

    private final String name;
    private final RequestRouter router;
    private final CircuitBreakerRegistry breakers;
    private final UsageTracker usageTracker;
    private final ProviderRegistry registry;
    private final ProviderTransport transport;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final MetricsCollector metrics;
    private final Clock clock;
    private final Duration callTimeout;

    public RoutedProviderStrategy(
            String name,
            RequestRouter router,
            CircuitBreakerRegistry breakers,
            UsageTracker usageTracker,
            ProviderRegistry registry,
            ProviderTransport transport,
            RetryPolicy retryPolicy,
            Sleeper sleeper,
            MetricsCollector metrics,
            Clock clock,
            Duration callTimeout
    ) {
        this.name = name;
        this.router = router;
        this.breakers = breakers;
        this.usageTracker = usageTracker;
        this.registry = registry;
        this.transport = transport;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.metrics = metrics;
        this.clock = clock;
        this.callTimeout = callTimeout;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CallOutcome attempt(GatewayRequest request, Set<String> excluded) {
        ProviderDescriptor provider;
        try {
            provider = router.select(new RoutingRequest(
                    request.capabilities(),
                    request.preferredProvider(),
                    excluded,
                    request.policy()
            ));
        } catch (ProviderUnavailableException e) {
            return CallOutcome.noProvider(e.getMessage());
        }

        String id = provider.id();
        CircuitBreaker breaker = breakers.forProvider(id);
        RetrySchedule schedule = retryPolicy.newSchedule();
        String lastError = null;

        while (true) {
            CircuitBreaker.Permit permit = breaker.acquire(clock.instant());
            if (permit == CircuitBreaker.Permit.DENIED) {
                lastError = lastError == null ? "circuit open" : lastError;
                break;
            }
            Instant reservedAt = clock.instant();
            UsageDecision decision = usageTracker.recordUsage(id, provider.costPerRequest());
            if (!decision.accepted()) {
                breaker.release(permit);
                lastError = decision.name().toLowerCase(Locale.ROOT);
                break;
            }

            schedule.onAttempt();
            long started = System.nanoTime();
            try {
                JsonNode result = transport.call(provider, request.method(), request.params(), callTimeout);
                long latencyMs = elapsedMs(started);
                breaker.onSuccess();
                registry.recordOutcome(id, true, latencyMs, clock.instant());
                metrics.providerCall(id, "success", latencyMs);
                return CallOutcome.success(id, result, schedule.attempts());
            } catch (RuntimeException e) {
                ProviderException failure = e instanceof ProviderException pe
                        ? pe
                        : new ProviderException(id, ProviderErrorType.UNKNOWN, request.method() + " failed", e);
                long latencyMs = elapsedMs(started);
                Instant now = clock.instant();
                CircuitState before = breaker.state(now);
                CircuitState after = breaker.onFailure(now);
                registry.recordOutcome(id, false, latencyMs, now);
                metrics.providerCall(id, failure.getType().name().toLowerCase(Locale.ROOT), latencyMs);
                if (!failure.getType().isCharged()) {
                    usageTracker.refund(id, provider.costPerRequest(), reservedAt);
                }
                lastError = failure.getSafeMessage();
                if (after == CircuitState.OPEN && before != CircuitState.OPEN) {
                    log.warn("Circuit opened provider={} consecutiveFailures={} lastError={}",
                            id, breaker.consecutiveFailures(), lastError);
                    break;
                }
                if (!schedule.canRetry()) {
                    break;
                }
                Duration delay = schedule.nextDelay();
                log.debug("Retrying provider={} method={} attempt={} delayMs={} error={}",
                        id, request.method(), schedule.attempts(), delay.toMillis(), lastError);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        return CallOutcome.failure(id, schedule.attempts(), lastError);
    }

    private static long elapsedMs(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }
}
