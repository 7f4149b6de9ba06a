/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.cache;

import com.cadena.application.metrics.MetricsCollector;
import com.cadena.config.AppProperties;
import com.cadena.domain.model.VolatilityTier;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Response cache whose TTL is chosen per entry from its volatility tier.
 * <p>
 * Two concurrent misses for the same key may both compute; the last write wins. Values pass through
 * {@code detach} on the way in and out, so callers never hold the stored instance.
 */
public class TieredResponseCache<V> {
    private final Cache<String, CacheEntry<V>> cache;
    private final Map<VolatilityTier, Duration> ttls;
    private final UnaryOperator<V> detach;
    private final MetricsCollector metrics;
    private final Clock clock;

    public TieredResponseCache(AppProperties.Cache config, UnaryOperator<V> detach, MetricsCollector metrics, Clock clock) {
        this(config, detach, metrics, clock, ForkJoinPool.commonPool());
    }

    TieredResponseCache(AppProperties.Cache config, UnaryOperator<V> detach, MetricsCollector metrics, Clock clock, Executor executor) {
        this.detach = detach;
        this.metrics = metrics;
        this.clock = clock;
        this.ttls = new EnumMap<>(VolatilityTier.class);
        ttls.put(VolatilityTier.HOT, config.hotTtl());
        ttls.put(VolatilityTier.WARM, config.warmTtl());
        ttls.put(VolatilityTier.COLD, config.coldTtl());
        ttls.put(VolatilityTier.FROZEN, config.frozenTtl());
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfter(new TierExpiry<V>())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(executor)
                .build();
    }

    public V getOrCompute(String key, VolatilityTier tier, Supplier<V> compute) {
        return getOrCompute(key, tier, compute, v -> true);
    }

    public V getOrCompute(String key, VolatilityTier tier, Supplier<V> compute, Predicate<? super V> cacheable) {
        Instant now = clock.instant();
        CacheEntry<V> hit = cache.getIfPresent(key);
        if (hit != null && !hit.isExpired(now)) {
            metrics.cacheHit();
            return detach.apply(hit.value());
        }
        if (hit != null) {
            cache.invalidate(key);
        }
        metrics.cacheMiss();

        V value = compute.get();
        if (value != null && cacheable.test(value)) {
            Duration ttl = ttl(tier);
            cache.put(key, new CacheEntry<>(key, detach.apply(value), tier, ttl, clock.instant().plus(ttl)));
        }
        return value;
    }

    public void invalidate(String key) {
        cache.invalidate(key);
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    public Duration ttl(VolatilityTier tier) {
        return ttls.get(tier);
    }

    @Scheduled(fixedDelayString = "${app.cache.sweep-interval-ms:60000}")
    public void sweep() {
        cache.cleanUp();
    }

    private static final class TierExpiry<V> implements Expiry<String, CacheEntry<V>> {
        @Override
        public long expireAfterCreate(String key, CacheEntry<V> value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry<V> value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, CacheEntry<V> value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
