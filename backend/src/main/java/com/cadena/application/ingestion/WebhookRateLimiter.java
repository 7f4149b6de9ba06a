/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.ingestion;

import com.cadena.config.AppProperties;
import com.cadena.config.ClockTimeMeter;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import io.github.bucket4j.TimeMeter;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Component
public class WebhookRateLimiter {
    private final Cache<String, Bucket> buckets;
    private final int requests;
    private final Duration window;
    private final TimeMeter timeMeter;

    public WebhookRateLimiter(AppProperties properties, Clock clock) {
        this.requests = properties.webhook().rateLimit().requests();
        this.window = properties.webhook().rateLimit().window();
        this.timeMeter = new ClockTimeMeter(clock);
        this.buckets = Caffeine.newBuilder()
                .expireAfterAccess(window.multipliedBy(2))
                .maximumSize(100_000)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    public Decision tryAcquire(String source) {
        Bucket bucket = buckets.get(source, k -> newBucket());
        ConsumptionProbe consumption = bucket.tryConsumeAndReturnRemaining(1);
        if (consumption.isConsumed()) {
            return new Decision(true, consumption.getRemainingTokens(), 0);
        }
        long retryAfterSeconds = Math.max(1, (long) Math.ceil(consumption.getNanosToWaitForRefill() / 1_000_000_000.0));
        return new Decision(false, 0, retryAfterSeconds);
    }

    public int limit() {
        return requests;
    }

    private Bucket newBucket() {
        return Bucket.builder()
                .addLimit(Bandwidth.classic(requests, Refill.intervally(requests, window)))
                .withCustomTimePrecision(timeMeter)
                .build();
    }

    public record Decision(boolean allowed, long remaining, long retryAfterSeconds) {}
}
