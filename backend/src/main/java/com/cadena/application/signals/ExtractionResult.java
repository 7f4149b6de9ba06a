/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.signals;

import com.cadena.domain.model.ExtractedSignal;
import com.cadena.domain.model.RiskIndicator;

import java.util.List;

public record ExtractionResult(List<ExtractedSignal> signals, List<RiskIndicator> risks) {
    public ExtractionResult {
        signals = List.copyOf(signals);
        risks = List.copyOf(risks);
    }

    public boolean isEmpty() {
        return signals.isEmpty() && risks.isEmpty();
    }
}
