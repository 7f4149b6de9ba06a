/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.dispatch;

import com.cadena.domain.model.ExtractedSignal;
import com.cadena.domain.model.RiskIndicator;

import java.util.List;

public record DispatchEnvelope(
        String eventId,
        String provider,
        String source,
        long timestamp,
        List<ExtractedSignal> signals,
        List<RiskIndicator> riskIndicators
) {
    public DispatchEnvelope {
        signals = signals == null ? List.of() : List.copyOf(signals);
        riskIndicators = riskIndicators == null ? List.of() : List.copyOf(riskIndicators);
    }
}
