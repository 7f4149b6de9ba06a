/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.api.webhooks;

import com.cadena.api.ApiException;
import com.cadena.application.ingestion.IngestionResult;
import com.cadena.application.ingestion.WebhookIngestor;
import com.cadena.application.metrics.MetricsCollector;
import com.cadena.application.metrics.MetricsSnapshot;
import com.cadena.config.RequestIdFilter;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.regex.Pattern;

@RestController
@RequestMapping("/webhooks")
public class WebhookController {
    private static final Pattern PROVIDER_NAME = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final WebhookIngestor ingestor;
    private final MetricsCollector metrics;

    public WebhookController(WebhookIngestor ingestor, MetricsCollector metrics) {
        this.ingestor = ingestor;
        this.metrics = metrics;
    }

    @PostMapping(value = "/{provider}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public WebhookAcceptedResponse receive(@PathVariable("provider") String provider, @RequestBody String payload) {
        if (!PROVIDER_NAME.matcher(provider).matches()) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "Invalid provider name");
        }
        IngestionResult result = ingestor.ingest(provider, payload);
        return new WebhookAcceptedResponse(
                "accepted",
                result.received(),
                result.processed(),
                result.duplicates(),
                result.dispatched(),
                MDC.get(RequestIdFilter.MDC_KEY)
        );
    }

    @GetMapping("/metrics")
    public MetricsSnapshot metrics() {
        return metrics.snapshot();
    }
}
