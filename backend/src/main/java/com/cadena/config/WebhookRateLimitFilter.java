/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.config;

import com.cadena.application.ingestion.WebhookRateLimiter;
import com.cadena.application.metrics.MetricsCollector;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * First gate for inbound webhooks. Rejected requests are answered here and never reach authentication.
 */
public class WebhookRateLimitFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(WebhookRateLimitFilter.class);
    static final String LIMIT_HEADER = "X-RateLimit-Limit";
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";

    private final WebhookRateLimiter rateLimiter;
    private final MetricsCollector metrics;
    private final JsonErrorWriter errorWriter;

    public WebhookRateLimitFilter(WebhookRateLimiter rateLimiter, MetricsCollector metrics, JsonErrorWriter errorWriter) {
        this.rateLimiter = rateLimiter;
        this.metrics = metrics;
        this.errorWriter = errorWriter;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !isWebhookDelivery(request);
    }

    static boolean isWebhookDelivery(HttpServletRequest request) {
        String path = request.getRequestURI();
        return HttpMethod.POST.matches(request.getMethod())
                && path.startsWith("/webhooks/")
                && !path.equals("/webhooks/metrics");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String source = ClientSource.of(request);
        WebhookRateLimiter.Decision decision = rateLimiter.tryAcquire(source);
        response.setHeader(LIMIT_HEADER, String.valueOf(rateLimiter.limit()));
        response.setHeader(REMAINING_HEADER, String.valueOf(decision.remaining()));
        if (!decision.allowed()) {
            metrics.webhookRejected("rate_limited");
            log.warn("Webhook rate limit exceeded source={} retryAfterSeconds={}", source, decision.retryAfterSeconds());
            response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
            errorWriter.write(response, HttpStatus.TOO_MANY_REQUESTS, "RATE_LIMITED", "Too many requests");
            return;
        }
        filterChain.doFilter(request, response);
    }
}
