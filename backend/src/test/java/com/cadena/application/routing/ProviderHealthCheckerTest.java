/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.routing;

import com.cadena.application.provider.ProviderRegistry;
import com.cadena.application.resilience.CircuitBreakerRegistry;
import com.cadena.config.AppProperties;
import com.cadena.domain.model.CircuitState;
import com.cadena.domain.model.ProviderDescriptor;
import com.cadena.infrastructure.provider.ProviderErrorType;
import com.cadena.infrastructure.provider.ProviderException;
import com.cadena.infrastructure.provider.ProviderTransport;
import com.cadena.support.MutableClock;
import com.cadena.support.TestProperties;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static com.cadena.support.TestProperties.provider;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProviderHealthCheckerTest {
    private final MutableClock clock = MutableClock.at("2025-01-01T00:00:00Z");

    @Mock
    ProviderTransport transport;

    private ProviderRegistry registry;
    private CircuitBreakerRegistry breakers;
    private ProviderHealthChecker checker;
    private ProviderDescriptor alpha;

    @BeforeEach
    void setUp() {
        AppProperties properties = TestProperties.builder()
                .provider(provider("alpha", 1000, 0.0))
                .circuitBreaker(new AppProperties.CircuitBreaker(2, Duration.ofSeconds(30)))
                .healthCheck(new AppProperties.HealthCheck(true, Duration.ofSeconds(3)))
                .build();
        registry = new ProviderRegistry(properties);
        breakers = new CircuitBreakerRegistry(properties, clock);
        checker = new ProviderHealthChecker(registry, breakers, transport, properties, clock);
        alpha = registry.find("alpha").orElseThrow();
    }

    @Test
    void passingCheckClosesACircuitWhoseCooldownElapsed() {
        tripOpen();
        clock.advance(Duration.ofSeconds(30));
        when(transport.call(eq(alpha), eq("getHealth"), isNull(), eq(Duration.ofSeconds(3))))
                .thenReturn(TextNode.valueOf("ok"));

        assertTrue(checker.check(alpha));

        assertEquals(CircuitState.CLOSED, breakers.state("alpha"));
        assertEquals(1, registry.stats("alpha").samples());
    }

    @Test
    void providerInsideItsCooldownIsNotCalled() {
        tripOpen();
        clock.advance(Duration.ofSeconds(10));

        assertFalse(checker.check(alpha));

        verify(transport, never()).call(any(), any(), any(), any());
        assertEquals(CircuitState.OPEN, breakers.state("alpha"));
    }

    @Test
    void failingChecksOpenTheCircuit() {
        when(transport.call(any(), any(), any(), any()))
                .thenThrow(new ProviderException("alpha", ProviderErrorType.CONNECTION, "connection refused"));

        checker.checkAll();
        assertEquals(CircuitState.CLOSED, breakers.state("alpha"));
        checker.checkAll();

        assertEquals(CircuitState.OPEN, breakers.state("alpha"));
        assertEquals(2, registry.stats("alpha").samples());
        verify(transport, times(2)).call(any(), any(), any(), any());
    }

    @Test
    void passingCheckOnAClosedCircuitKeepsItsFailureCount() {
        breakers.forProvider("alpha").onFailure(clock.instant());
        when(transport.call(any(), any(), any(), any())).thenReturn(TextNode.valueOf("ok"));

        checker.checkAll();

        assertEquals(1, breakers.forProvider("alpha").consecutiveFailures());
    }

    private void tripOpen() {
        breakers.forProvider("alpha").onFailure(clock.instant());
        breakers.forProvider("alpha").onFailure(clock.instant());
        assertEquals(CircuitState.OPEN, breakers.state("alpha"));
    }
}
