/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.ingestion;

import com.cadena.config.AppProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

@Component
public class DedupWindow {
    private final Cache<String, Instant> seen;
    private final Clock clock;

    public DedupWindow(AppProperties properties, Clock clock) {
        this.clock = clock;
        this.seen = Caffeine.newBuilder()
                .expireAfterWrite(properties.webhook().dedupWindow())
                .maximumSize(properties.webhook().dedupMaxEntries())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    /**
     * Atomically records the signature; returns false if it was already recorded within the window.
     */
    public boolean firstSeen(String signature) {
        return seen.asMap().putIfAbsent(signature, clock.instant()) == null;
    }

    public void forget(String signature) {
        seen.invalidate(signature);
    }
}
