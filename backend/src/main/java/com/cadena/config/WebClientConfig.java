/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {
    private static final int CONNECT_TIMEOUT_MS = 2_000;

    @Bean
    public WebClient providerWebClient(AppProperties properties) {
        return build(properties.retry().callTimeout(), 2 * 1024 * 1024);
    }

    @Bean
    public WebClient dispatchWebClient(AppProperties properties) {
        Duration longest = properties.dispatch().targets().stream()
                .map(AppProperties.Dispatch.Target::timeout)
                .max(Duration::compareTo)
                .orElse(Duration.ofSeconds(5));
        return build(longest, 256 * 1024);
    }

    private static WebClient build(Duration timeout, int maxInMemorySize) {
        long timeoutMs = Math.max(1, timeout.toMillis());
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(CONNECT_TIMEOUT_MS, timeoutMs))
                .responseTimeout(timeout)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS)));

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(maxInMemorySize))
                        .build())
                .build();
    }
}
