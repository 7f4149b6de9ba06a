/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.provider;

import com.cadena.config.AppProperties;
import com.cadena.support.MutableClock;
import com.cadena.support.TestProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.cadena.support.TestProperties.provider;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UsageTrackerTest {
    private final MutableClock clock = MutableClock.at("2025-03-15T10:00:00Z");

    private UsageTracker tracker(AppProperties properties) {
        return new UsageTracker(new ProviderRegistry(properties), properties, clock);
    }

    @Test
    void refusesOnceQuotaIsReachedWithoutTouchingTheCounter() {
        UsageTracker tracker = tracker(TestProperties.builder().provider(provider("a", 3, 0.5)).build());

        assertEquals(UsageDecision.ACCEPTED, tracker.recordUsage("a", 0.5));
        assertEquals(UsageDecision.ACCEPTED, tracker.recordUsage("a", 0.5));
        assertEquals(UsageDecision.ACCEPTED, tracker.recordUsage("a", 0.5));
        assertEquals(UsageDecision.OVER_QUOTA, tracker.recordUsage("a", 0.5));

        ProviderUsage usage = tracker.usage("a");
        assertEquals(3, usage.used());
        assertEquals(1.5, usage.costThisPeriod(), 1e-9);
        assertEquals(0.0, usage.remainingFraction(), 1e-9);
        assertTrue(tracker.isOverQuota("a"));
    }

    @Test
    void concurrentReservationsNeverExceedQuota() throws Exception {
        UsageTracker tracker = tracker(TestProperties.builder().provider(provider("a", 100, 0.0)).build());
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 50; i++) {
                        if (tracker.recordUsage("a", 0.0) == UsageDecision.ACCEPTED) {
                            accepted.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(100, accepted.get());
        assertEquals(100, tracker.usage("a").used());
    }

    @Test
    void calendarMonthBoundaryResetsCounters() {
        UsageTracker tracker = tracker(TestProperties.builder().provider(provider("a", 2, 1.0)).build());
        tracker.recordUsage("a", 1.0);
        tracker.recordUsage("a", 1.0);
        assertTrue(tracker.isOverQuota("a"));

        clock.set(Instant.parse("2025-04-01T00:00:00Z"));

        assertFalse(tracker.isOverQuota("a"));
        ProviderUsage usage = tracker.usage("a");
        assertEquals(0, usage.used());
        assertEquals(0.0, usage.costThisPeriod(), 1e-9);
        assertEquals(Instant.parse("2025-04-01T00:00:00Z"), usage.periodStart());
    }

    @Test
    void periodResetHappensOncePerBoundary() {
        UsageTracker tracker = tracker(TestProperties.builder().provider(provider("a", 10, 0.0)).build());
        tracker.recordUsage("a", 0.0);

        clock.set(Instant.parse("2025-04-01T00:00:01Z"));
        tracker.rollPeriods();
        tracker.recordUsage("a", 0.0);
        tracker.rollPeriods();
        tracker.rollPeriods();

        assertEquals(1, tracker.usage("a").used());
    }

    @Test
    void clockMovingBackwardsDoesNotReset() {
        UsageTracker tracker = tracker(TestProperties.builder().provider(provider("a", 10, 0.0)).build());
        tracker.recordUsage("a", 0.0);

        clock.set(Instant.parse("2025-02-20T00:00:00Z"));

        assertEquals(1, tracker.usage("a").used());
    }

    @Test
    void rollingPeriodResetsAfterThirtyDays() {
        AppProperties properties = TestProperties.builder()
                .provider(provider("a", 10, 0.0))
                .quota(new AppProperties.Quota(QuotaPeriod.ROLLING_30_DAYS, null, null))
                .build();
        UsageTracker tracker = tracker(properties);
        tracker.recordUsage("a", 0.0);

        clock.advance(Duration.ofDays(29));
        assertEquals(1, tracker.usage("a").used());

        clock.advance(Duration.ofDays(1));
        assertEquals(0, tracker.usage("a").used());
    }

    @Test
    void refundReturnsAnUnchargedReservation() {
        UsageTracker tracker = tracker(TestProperties.builder().provider(provider("a", 1, 0.25)).build());
        Instant reservedAt = clock.instant();
        assertEquals(UsageDecision.ACCEPTED, tracker.recordUsage("a", 0.25));

        tracker.refund("a", 0.25, reservedAt);

        assertEquals(0, tracker.usage("a").used());
        assertEquals(UsageDecision.ACCEPTED, tracker.recordUsage("a", 0.25));
    }

    @Test
    void requestsPerMinuteLimitIsEnforcedPerMinute() {
        AppProperties properties = TestProperties.builder()
                .provider(new AppProperties.ProviderConfig("a", "http://a.invalid", null, 100L, 0.0, 2, 1, false, false))
                .build();
        UsageTracker tracker = tracker(properties);

        assertEquals(UsageDecision.ACCEPTED, tracker.recordUsage("a", 0.0));
        assertEquals(UsageDecision.ACCEPTED, tracker.recordUsage("a", 0.0));
        assertEquals(UsageDecision.RATE_LIMITED, tracker.recordUsage("a", 0.0));
        assertTrue(tracker.isRateLimited("a"));
        assertEquals(2, tracker.usage("a").used());

        clock.advance(Duration.ofMinutes(1));

        assertFalse(tracker.isRateLimited("a"));
        assertEquals(UsageDecision.ACCEPTED, tracker.recordUsage("a", 0.0));
    }

    @Test
    void refundReturnsTheMinuteSlot() {
        AppProperties properties = TestProperties.builder()
                .provider(new AppProperties.ProviderConfig("a", "http://a.invalid", null, 100L, 0.0, 1, 1, false, false))
                .build();
        UsageTracker tracker = tracker(properties);

        assertEquals(UsageDecision.ACCEPTED, tracker.recordUsage("a", 0.0));
        assertTrue(tracker.isRateLimited("a"));

        tracker.refund("a", 0.0);

        assertFalse(tracker.isRateLimited("a"));
        assertEquals(UsageDecision.ACCEPTED, tracker.recordUsage("a", 0.0));
        assertEquals(UsageDecision.RATE_LIMITED, tracker.recordUsage("a", 0.0));
    }

    @Test
    void minuteLimitRefillsFromTheInjectedClock() {
        AppProperties properties = TestProperties.builder()
                .provider(new AppProperties.ProviderConfig("a", "http://a.invalid", null, 100L, 0.0, 3, 1, false, false))
                .build();
        UsageTracker tracker = tracker(properties);
        for (int i = 0; i < 3; i++) {
            tracker.recordUsage("a", 0.0);
        }

        clock.advance(Duration.ofSeconds(59));
        assertEquals(UsageDecision.RATE_LIMITED, tracker.recordUsage("a", 0.0));

        clock.advance(Duration.ofSeconds(1));
        assertEquals(UsageDecision.ACCEPTED, tracker.recordUsage("a", 0.0));
        assertEquals(4, tracker.usage("a").used());
    }

    @Test
    void projectsMonthlyUsageFromElapsedDays() {
        clock.set(Instant.parse("2025-03-11T00:00:00Z"));
        UsageTracker tracker = tracker(TestProperties.builder().provider(provider("a", 1000, 0.5)).build());
        for (int i = 0; i < 10; i++) {
            tracker.recordUsage("a", 0.5);
        }

        ProviderUsage usage = tracker.usage("a");

        assertEquals(31, usage.projectedRequests());
        assertEquals(15.5, usage.projectedCost(), 1e-9);
    }
}
