/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.signals.rules;

import com.cadena.application.signals.Finding;
import com.cadena.application.signals.SignalRule;
import com.cadena.application.signals.SignalTypes;
import com.cadena.application.signals.TokenLaunches;
import com.cadena.config.AppProperties;
import com.cadena.domain.model.ChainEvent;
import com.cadena.domain.model.RiskIndicator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

@Component
@Order(70)
public class LowInitialLiquidityRule implements SignalRule {
    static final double SEVERITY = 0.4;
    private static final BigDecimal LAMPORTS_PER_SOL = new BigDecimal("1000000000");

    private final TokenLaunches launches;
    private final BigDecimal minLiquiditySol;

    public LowInitialLiquidityRule(TokenLaunches launches, AppProperties properties) {
        this.launches = launches;
        this.minLiquiditySol = properties.signals().launchRisk().minLiquiditySol();
    }

    @Override
    public String name() {
        return SignalTypes.LOW_INITIAL_LIQUIDITY;
    }

    @Override
    public Optional<Finding> evaluate(ChainEvent event) {
        if (!launches.isLaunch(event)) {
            return Optional.empty();
        }
        long lamports = event.nativeTransfers().stream().mapToLong(t -> Math.abs(t.amount())).sum();
        BigDecimal sol = BigDecimal.valueOf(lamports).divide(LAMPORTS_PER_SOL);
        if (sol.compareTo(minLiquiditySol) >= 0) {
            return Optional.empty();
        }
        return Optional.of(Finding.of(new RiskIndicator(
                SignalTypes.LOW_INITIAL_LIQUIDITY,
                SEVERITY,
                "Launch moved " + sol.toPlainString() + " SOL",
                event.signature()
        )));
    }
}
