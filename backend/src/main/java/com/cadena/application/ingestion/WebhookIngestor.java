/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.ingestion;

import com.cadena.api.ApiException;
import com.cadena.application.dispatch.DispatchEnvelope;
import com.cadena.application.dispatch.EventDispatcher;
import com.cadena.application.metrics.MetricsCollector;
import com.cadena.application.signals.ExtractionResult;
import com.cadena.application.signals.SignalExtractor;
import com.cadena.domain.model.ChainEvent;
import com.cadena.domain.model.WebhookEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Authenticated webhook bodies enter here: validate, dedup, enrich, extract, dispatch.
 */
@Service
public class WebhookIngestor {
    private static final Logger log = LoggerFactory.getLogger(WebhookIngestor.class);

    private final WebhookPayloadParser parser;
    private final DedupWindow dedupWindow;
    private final TokenMetadataEnricher enricher;
    private final SignalExtractor extractor;
    private final EventDispatcher dispatcher;
    private final MetricsCollector metrics;
    private final Clock clock;

    public WebhookIngestor(
            WebhookPayloadParser parser,
            DedupWindow dedupWindow,
            TokenMetadataEnricher enricher,
            SignalExtractor extractor,
            EventDispatcher dispatcher,
            MetricsCollector metrics,
            Clock clock
    ) {
        this.parser = parser;
        this.dedupWindow = dedupWindow;
        this.enricher = enricher;
        this.extractor = extractor;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.clock = clock;
    }

    public IngestionResult ingest(String provider, String body) {
        long started = System.nanoTime();
        List<ParsedEvent> events;
        try {
            events = parser.parse(body);
        } catch (ApiException e) {
            metrics.webhookRejected("validation");
            throw e;
        }
        metrics.webhookEvents("received", events.size());

        int duplicates = 0;
        int processed = 0;
        int failed = 0;
        List<DispatchEnvelope> envelopes = new ArrayList<>();
        for (ParsedEvent parsed : events) {
            String signature = parsed.event().signature();
            if (!dedupWindow.firstSeen(signature)) {
                duplicates++;
                continue;
            }
            WebhookEvent event = new WebhookEvent(signature, provider, clock.instant(), parsed.rawJson(), true, parsed.event());
            try {
                process(event).ifPresent(envelopes::add);
                processed++;
            } catch (RuntimeException e) {
                failed++;
                dedupWindow.forget(signature);
                log.error("Webhook event processing failed provider={} signature={}", provider, signature, e);
            }
        }
        if (!envelopes.isEmpty()) {
            dispatcher.dispatchAll(envelopes);
        }
        int dispatched = envelopes.size();

        metrics.webhookEvents("succeeded", processed);
        metrics.webhookEvents("failed", failed);
        IngestionResult result = new IngestionResult(events.size(), processed, duplicates, failed, dispatched);
        if (result.allDuplicates()) {
            log.info("Webhook replay ignored provider={} events={}", provider, events.size());
            return result;
        }
        long latencyMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
        metrics.webhookProcessed(latencyMs);
        log.info("Webhook accepted provider={} received={} processed={} duplicates={} dispatched={} latencyMs={}",
                provider, result.received(), processed, duplicates, dispatched, latencyMs);
        return result;
    }

    private Optional<DispatchEnvelope> process(WebhookEvent event) {
        ChainEvent enriched = enricher.enrich(event.event());
        WebhookEvent ready = enriched == event.event() ? event : event.withEvent(enriched);

        ExtractionResult extraction = extractor.extract(ready);
        if (extraction.isEmpty()) {
            return Optional.empty();
        }
        ChainEvent chainEvent = ready.event();
        return Optional.of(new DispatchEnvelope(
                ready.signature(),
                ready.provider(),
                chainEvent.source(),
                chainEvent.timestamp(),
                extraction.signals(),
                extraction.risks()
        ));
    }
}
