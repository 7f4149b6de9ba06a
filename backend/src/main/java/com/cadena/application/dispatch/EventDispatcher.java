/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.dispatch;

import com.cadena.application.metrics.MetricsCollector;
import com.cadena.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Fans envelopes out to every configured target in parallel.
 * <p>
 * Each target has its own timeout and the whole fan-out is bounded by a global deadline; a target with no
 * result by then is reported as timed out. Failures never propagate to the caller.
 */
@Service
public class EventDispatcher {
    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final List<AppProperties.Dispatch.Target> targets;
    private final Duration deadline;
    private final DownstreamClient client;
    private final MetricsCollector metrics;

    public EventDispatcher(AppProperties properties, DownstreamClient client, MetricsCollector metrics) {
        this.targets = properties.dispatch().targets();
        this.deadline = properties.dispatch().deadline();
        this.client = client;
        this.metrics = metrics;
    }

    public List<DispatchResult> dispatch(DispatchEnvelope envelope) {
        return dispatchAll(List.of(envelope)).get(0);
    }

    public List<List<DispatchResult>> dispatchAll(List<DispatchEnvelope> envelopes) {
        if (targets.isEmpty() || envelopes.isEmpty()) {
            return envelopes.stream().map(e -> List.<DispatchResult>of()).toList();
        }
        long started = System.nanoTime();
        List<Map<String, DispatchResult>> results = new ArrayList<>(envelopes.size());
        List<Mono<DispatchResult>> calls = new ArrayList<>(envelopes.size() * targets.size());
        for (DispatchEnvelope envelope : envelopes) {
            Map<String, DispatchResult> byTarget = new ConcurrentHashMap<>();
            results.add(byTarget);
            for (AppProperties.Dispatch.Target target : targets) {
                calls.add(deliver(target, envelope).doOnNext(r -> byTarget.put(r.targetId(), r)));
            }
        }
        Flux.merge(calls)
                .then()
                .timeout(deadline)
                .onErrorResume(TimeoutException.class, e -> Mono.empty())
                .block();

        List<List<DispatchResult>> all = new ArrayList<>(envelopes.size());
        for (int i = 0; i < envelopes.size(); i++) {
            all.add(collect(envelopes.get(i), results.get(i), started));
        }
        return all;
    }

    private List<DispatchResult> collect(DispatchEnvelope envelope, Map<String, DispatchResult> byTarget, long started) {
        List<DispatchResult> ordered = new ArrayList<>(targets.size());
        for (AppProperties.Dispatch.Target target : targets) {
            DispatchResult r = byTarget.get(target.id());
            if (r == null) {
                r = DispatchResult.timedOut(target.id(), elapsedMs(started));
            }
            record(envelope, r);
            ordered.add(r);
        }
        return ordered;
    }

    private Mono<DispatchResult> deliver(AppProperties.Dispatch.Target target, DispatchEnvelope envelope) {
        return Mono.defer(() -> {
            long started = System.nanoTime();
            return client.deliver(target, envelope)
                    .timeout(target.timeout())
                    .then(Mono.fromSupplier(() -> DispatchResult.succeeded(target.id(), elapsedMs(started))))
                    .onErrorResume(e -> Mono.just(e instanceof TimeoutException
                            ? DispatchResult.timedOut(target.id(), elapsedMs(started))
                            : DispatchResult.failed(target.id(), elapsedMs(started), describe(e))));
        });
    }

    private void record(DispatchEnvelope envelope, DispatchResult r) {
        String outcome = r.success() ? "success" : r.timedOut() ? "timeout" : "failure";
        metrics.dispatch(r.targetId(), outcome, r.latencyMs());
        if (!r.success()) {
            log.warn("Dispatch failed target={} eventId={} timedOut={} error={}",
                    r.targetId(), envelope.eventId(), r.timedOut(), r.error());
        }
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static long elapsedMs(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }
}
