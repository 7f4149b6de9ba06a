/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.config;

import com.cadena.application.ingestion.WebhookRateLimiter;
import com.cadena.application.metrics.MetricsCollector;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
public class SecurityConfig {

    @Bean
    @Order(0)
    public SecurityFilterChain actuatorSecurityFilterChain(HttpSecurity http) throws Exception {
        http
                .securityMatcher("/actuator    @Bean
    public SecurityFilterChain securityFilterChain(
            HttpSecurity http,
            AppProperties properties,
            WebhookRateLimiter rateLimiter,
            MetricsCollector metrics,
            JsonErrorWriter errorWriter,
            RestAuthenticationEntryPoint restAuthenticationEntryPoint
    ) throws Exception {
        WebhookRateLimitFilter rateLimitFilter = new WebhookRateLimitFilter(rateLimiter, metrics, errorWriter);
        WebhookAuthenticationFilter authenticationFilter =
                new WebhookAuthenticationFilter(properties.webhook().secret(), metrics);

        http
                .csrf(csrf -> csrf.disable())
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .exceptionHandling(ex -> ex.authenticationEntryPoint(restAuthenticationEntryPoint))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(HttpMethod.GET, "/webhooks/metrics").permitAll()
                        .requestMatchers(HttpMethod.POST, "/webhooks/**").hasRole(WebhookAuthenticationFilter.ROLE)
                        .requestMatchers("/api/**").hasRole(WebhookAuthenticationFilter.ROLE)
                        .requestMatchers("/error").permitAll()
                        .anyRequest().denyAll()
                )
                .addFilterBefore(rateLimitFilter, UsernamePasswordAuthenticationFilter.class)
                .addFilterAfter(authenticationFilter, WebhookRateLimitFilter.class);

        return http.build();
    }

    @Bean
    public UserDetailsService userDetailsService() {
        return new InMemoryUserDetailsManager();
    }
}
