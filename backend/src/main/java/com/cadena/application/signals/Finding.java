/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.signals;

import com.cadena.domain.model.ExtractedSignal;
import com.cadena.domain.model.RiskIndicator;

public record Finding(ExtractedSignal signal, RiskIndicator risk) {
    public Finding {
        if ((signal == null) == (risk == null)) {
            throw new IllegalArgumentException("exactly one of signal or risk must be set");
        }
    }

    public static Finding of(ExtractedSignal signal) {
        return new Finding(signal, null);
    }

    public static Finding of(RiskIndicator risk) {
        return new Finding(null, risk);
    }
}
