/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.config;

import com.cadena.application.metrics.MetricsCollector;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

public class WebhookAuthenticationFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(WebhookAuthenticationFilter.class);
    public static final String ROLE = "INTEGRATION";
    private static final String BEARER = "Bearer ";

    private final byte[] secret;
    private final MetricsCollector metrics;

    public WebhookAuthenticationFilter(String secret, MetricsCollector metrics) {
        this.secret = secret == null || secret.isBlank() ? null : secret.getBytes(StandardCharsets.UTF_8);
        this.metrics = metrics;
        if (this.secret == null) {
            log.warn("app.webhook.secret is not set; every webhook and API call will be rejected");
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !(WebhookRateLimitFilter.isWebhookDelivery(request) || request.getRequestURI().startsWith("/api/"));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER) && matches(header.substring(BEARER.length()).trim())) {
            var auth = new UsernamePasswordAuthenticationToken(
                    "integration",
                    null,
                    List.of(new SimpleGrantedAuthority("ROLE_" + ROLE))
            );
            SecurityContextHolder.getContext().setAuthentication(auth);
        } else {
            if (WebhookRateLimitFilter.isWebhookDelivery(request)) {
                metrics.webhookRejected("unauthorized");
            }
            log.warn("Rejected unauthenticated request path={} source={}", request.getRequestURI(), ClientSource.of(request));
        }
        filterChain.doFilter(request, response);
    }

    boolean matches(String token) {
        if (secret == null || token.isEmpty()) return false;
        return MessageDigest.isEqual(secret, token.getBytes(StandardCharsets.UTF_8));
    }
}
