/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.domain.model;

import java.util.Map;

public record ExtractedSignal(
        String type,
        double strength,
        double confidence,
        Map<String, Object> metadata,
        String eventSignature
) {
    public ExtractedSignal {
        if (type == null || type.isBlank()) throw new IllegalArgumentException("signal type required");
        strength = clamp01(strength);
        confidence = clamp01(confidence);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    static double clamp01(double v) {
        if (Double.isNaN(v) || v < 0) return 0;
        if (v > 1) return 1;
        return v;
    }
}
