/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.dispatch;

public record DispatchResult(
        String targetId,
        boolean success,
        long latencyMs,
        String error,
        boolean timedOut
) {
    public static DispatchResult succeeded(String targetId, long latencyMs) {
        return new DispatchResult(targetId, true, latencyMs, null, false);
    }

    public static DispatchResult failed(String targetId, long latencyMs, String error) {
        return new DispatchResult(targetId, false, latencyMs, error, false);
    }

    public static DispatchResult timedOut(String targetId, long latencyMs) {
        return new DispatchResult(targetId, false, latencyMs, "timed out", true);
    }
}
