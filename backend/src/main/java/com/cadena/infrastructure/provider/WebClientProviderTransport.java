/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.infrastructure.provider;

import com.cadena.domain.model.ProviderDescriptor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class WebClientProviderTransport implements ProviderTransport {
    private static final Logger log = LoggerFactory.getLogger(WebClientProviderTransport.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final AtomicLong ids = new AtomicLong();

    public WebClientProviderTransport(@Qualifier("providerWebClient") WebClient webClient, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public JsonNode call(ProviderDescriptor provider, String method, JsonNode params, Duration timeout) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jsonrpc", "2.0");
        body.put("id", ids.incrementAndGet());
        body.put("method", method);
        body.put("params", params == null ? objectMapper.createArrayNode() : params);

        JsonNode response;
        try {
            response = webClient.post()
                    .uri(endpoint(provider))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            throw translate(provider.id(), method, Exceptions.unwrap(e));
        }

        if (response == null) {
            throw new ProviderException(provider.id(), ProviderErrorType.UNKNOWN, "Empty response for " + method);
        }
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            String message = error.path("message").asText("JSON-RPC error");
            throw new ProviderException(provider.id(), ProviderErrorType.RPC_ERROR, method + " failed: " + message);
        }
        if (!response.has("result")) {
            throw new ProviderException(provider.id(), ProviderErrorType.RPC_ERROR, "Missing result for " + method);
        }
        return response.get("result");
    }

    static String endpoint(ProviderDescriptor provider) {
        String base = provider.baseUrl();
        if (provider.apiKey() == null || provider.apiKey().isBlank()) {
            return base;
        }
        return base.endsWith("/") ? base + provider.apiKey() : base + "/" + provider.apiKey();
    }

    private ProviderException translate(String providerId, String method, Throwable error) {
        if (error instanceof TimeoutException) {
            return new ProviderException(providerId, ProviderErrorType.TIMEOUT, method + " timed out", error);
        }
        if (error instanceof WebClientResponseException http) {
            int status = http.getStatusCode().value();
            ProviderErrorType type = status == 429
                    ? ProviderErrorType.RATE_LIMITED
                    : status >= 500 ? ProviderErrorType.HTTP_5XX : ProviderErrorType.HTTP_4XX;
            return new ProviderException(providerId, type, method + " returned HTTP " + status, error);
        }
        if (error instanceof WebClientRequestException) {
            return new ProviderException(providerId, ProviderErrorType.CONNECTION, method + " connection failed", error);
        }
        log.debug("Unclassified provider failure provider={} method={}", providerId, method, error);
        return new ProviderException(providerId, ProviderErrorType.UNKNOWN, method + " failed", error);
    }
}
