/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.provider;

import com.cadena.domain.model.ProviderDescriptor;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import io.github.bucket4j.TimeMeter;

import java.time.Duration;
import java.time.Instant;

// Every method is guarded by the instance monitor.
final class UsageCounter {
    private static final double SECONDS_PER_DAY = 86_400.0;

    private final ProviderDescriptor provider;
    private final QuotaPeriod period;

    private Instant periodStart;
    private long used;
    private double cost;
    private final Bucket perMinute;
    private Instant lastAlertAt;

    UsageCounter(ProviderDescriptor provider, QuotaPeriod period, Instant now, TimeMeter timeMeter) {
        this.provider = provider;
        this.period = period;
        this.periodStart = period.initialStart(now);
        this.perMinute = minuteBucket(provider.requestsPerMinute(), timeMeter);
    }

    synchronized boolean roll(Instant now) {
        Instant current = period.currentStart(periodStart, now);
        if (current.equals(periodStart)) {
            return false;
        }
        periodStart = current;
        used = 0;
        cost = 0;
        lastAlertAt = null;
        return true;
    }

    synchronized UsageDecision reserve(double requestCost, Instant now) {
        roll(now);
        if (used + 1 > provider.monthlyQuota()) {
            return UsageDecision.OVER_QUOTA;
        }
        if (perMinute != null && !perMinute.tryConsume(1)) {
            return UsageDecision.RATE_LIMITED;
        }
        used++;
        cost += requestCost;
        return UsageDecision.ACCEPTED;
    }

    synchronized void refund(double requestCost, Instant reservedAt, Instant now) {
        roll(now);
        if (reservedAt.isBefore(periodStart) || used == 0) {
            return;
        }
        used--;
        cost = Math.max(0, cost - requestCost);
        if (perMinute != null) {
            perMinute.addTokens(1);
        }
    }

    synchronized boolean isOverQuota(Instant now) {
        roll(now);
        return used >= provider.monthlyQuota();
    }

    synchronized boolean isRateLimited() {
        return perMinute != null && perMinute.getAvailableTokens() < 1;
    }

    synchronized boolean claimAlert(double threshold, Duration interval, Instant now) {
        long quota = provider.monthlyQuota();
        if (quota <= 0 || (double) used / quota < threshold) {
            return false;
        }
        if (lastAlertAt != null && Duration.between(lastAlertAt, now).compareTo(interval) < 0) {
            return false;
        }
        lastAlertAt = now;
        return true;
    }

    synchronized ProviderUsage snapshot(Instant now) {
        roll(now);
        long quota = provider.monthlyQuota();
        double remaining = quota <= 0 ? 0.0 : Math.max(0.0, 1.0 - (double) used / quota);
        double periodDays = period.length(periodStart).getSeconds() / SECONDS_PER_DAY;
        double elapsedDays = Math.max(1.0, Duration.between(periodStart, now).getSeconds() / SECONDS_PER_DAY);
        long projectedRequests = Math.round(used / elapsedDays * periodDays);
        double projectedCost = cost / elapsedDays * periodDays;
        return new ProviderUsage(provider.id(), used, quota, remaining, cost, periodStart, projectedRequests, projectedCost);
    }

    private static Bucket minuteBucket(Integer rpm, TimeMeter timeMeter) {
        if (rpm == null || rpm < 1) {
            return null;
        }
        return Bucket.builder()
                .addLimit(Bandwidth.classic(rpm, Refill.intervally(rpm, Duration.ofMinutes(1))))
                .withCustomTimePrecision(timeMeter)
                .build();
    }
}
