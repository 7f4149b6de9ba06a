/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.metrics;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record MetricsSnapshot(
        Instant timestamp,
        Webhooks webhooks,
        List<ProviderMetrics> providers,
        Cache cache,
        Map<String, Latency> latency,
        Dispatch dispatch,
        long degradedResults
) {
    public record Webhooks(long received, long succeeded, long failed, Map<String, Long> rejections) {}

    public record ProviderMetrics(
            String provider,
            long requests,
            long failures,
            long used,
            long quota,
            double cost,
            long projectedRequests,
            double projectedCost
    ) {}

    public record Cache(long hits, long misses, double hitRate) {}

    public record Latency(long count, double p50Ms, double p95Ms, double p99Ms) {}

    public record Dispatch(long succeeded, long failed, long timedOut) {}
}
