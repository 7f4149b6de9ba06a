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

import java.util.Optional;

@Component
@Order(50)
public class HighTransactionFeeRule implements SignalRule {
    static final double SEVERITY = 0.2;

    private final TokenLaunches launches;
    private final long highFeeLamports;

    public HighTransactionFeeRule(TokenLaunches launches, AppProperties properties) {
        this.launches = launches;
        this.highFeeLamports = properties.signals().launchRisk().highFeeLamports();
    }

    @Override
    public String name() {
        return SignalTypes.HIGH_TRANSACTION_FEE;
    }

    @Override
    public Optional<Finding> evaluate(ChainEvent event) {
        if (event.fee() == null || event.fee() <= highFeeLamports || !launches.isLaunch(event)) {
            return Optional.empty();
        }
        return Optional.of(Finding.of(new RiskIndicator(
                SignalTypes.HIGH_TRANSACTION_FEE,
                SEVERITY,
                "Launch paid a fee of " + event.fee() + " lamports",
                event.signature()
        )));
    }
}
