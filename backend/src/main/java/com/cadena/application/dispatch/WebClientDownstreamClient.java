/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.dispatch;

import com.cadena.config.AppProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@Component
public class WebClientDownstreamClient implements DownstreamClient {
    private final WebClient webClient;

    public WebClientDownstreamClient(@Qualifier("dispatchWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public Mono<Void> deliver(AppProperties.Dispatch.Target target, DispatchEnvelope envelope) {
        return webClient.post()
                .uri(target.url())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(envelope)
                .retrieve()
                .toBodilessEntity()
                .then();
    }
}
