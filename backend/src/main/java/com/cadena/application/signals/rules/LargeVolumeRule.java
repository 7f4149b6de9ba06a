/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.signals.rules;

import com.cadena.application.signals.Finding;
import com.cadena.application.signals.SignalRule;
import com.cadena.application.signals.SignalTypes;
import com.cadena.application.signals.UsdValuation;
import com.cadena.config.AppProperties;
import com.cadena.domain.model.ChainEvent;
import com.cadena.domain.model.ExtractedSignal;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Optional;

@Component
@Order(10)
public class LargeVolumeRule implements SignalRule {
    public static final String NATIVE_MINT = "SOL";
    static final double CONFIDENCE = 0.8;

    private final UsdValuation valuation;
    private final BigDecimal threshold;
    private final BigDecimal referenceCeiling;

    public LargeVolumeRule(UsdValuation valuation, AppProperties properties) {
        this.valuation = valuation;
        this.threshold = properties.signals().largeVolumeUsdThreshold();
        this.referenceCeiling = properties.signals().referenceCeilingUsd();
    }

    @Override
    public String name() {
        return SignalTypes.LARGE_VOLUME;
    }

    @Override
    public Optional<Finding> evaluate(ChainEvent event) {
        BigDecimal largest = null;
        String largestMint = null;
        int counted = 0;

        for (ChainEvent.NativeTransfer t : event.nativeTransfers()) {
            if (t.isSelfTransfer()) continue;
            Optional<BigDecimal> usd = valuation.valueOf(t);
            if (usd.isEmpty()) continue;
            counted++;
            if (largest == null || usd.get().compareTo(largest) > 0) {
                largest = usd.get();
                largestMint = NATIVE_MINT;
            }
        }
        for (ChainEvent.TokenTransfer t : event.tokenTransfers()) {
            if (t.isSelfTransfer()) continue;
            Optional<BigDecimal> usd = valuation.valueOf(t);
            if (usd.isEmpty()) continue;
            counted++;
            if (largest == null || usd.get().compareTo(largest) > 0) {
                largest = usd.get();
                largestMint = t.mint() == null ? "unknown" : t.mint();
            }
        }

        if (largest == null || largest.compareTo(threshold) <= 0) {
            return Optional.empty();
        }

        double strength = largest.divide(referenceCeiling, MathContext.DECIMAL64).doubleValue();
        Map<String, Object> metadata = Map.of(
                "usdValue", largest.setScale(2, RoundingMode.HALF_UP),
                "mint", largestMint,
                "transferCount", counted
        );
        return Optional.of(Finding.of(new ExtractedSignal(
                SignalTypes.LARGE_VOLUME,
                Math.min(1.0, strength),
                CONFIDENCE,
                metadata,
                event.signature()
        )));
    }
}
