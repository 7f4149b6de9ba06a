/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.domain.model;

public record RiskIndicator(
        String type,
        double severity,
        String description,
        String eventSignature
) {
    public RiskIndicator {
        if (type == null || type.isBlank()) throw new IllegalArgumentException("risk type required");
        severity = ExtractedSignal.clamp01(severity);
    }
}
