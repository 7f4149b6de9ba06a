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

import java.util.Objects;
import java.util.Optional;

@Component
@Order(80)
public class FewInitialHoldersRule implements SignalRule {
    static final double SEVERITY = 0.2;

    private final TokenLaunches launches;
    private final int minHolders;

    public FewInitialHoldersRule(TokenLaunches launches, AppProperties properties) {
        this.launches = launches;
        this.minHolders = properties.signals().launchRisk().minHolders();
    }

    @Override
    public String name() {
        return SignalTypes.FEW_INITIAL_HOLDERS;
    }

    @Override
    public Optional<Finding> evaluate(ChainEvent event) {
        if (!launches.isLaunch(event)) {
            return Optional.empty();
        }
        long holders = event.tokenTransfers().stream()
                .map(ChainEvent.TokenTransfer::toUserAccount)
                .filter(Objects::nonNull)
                .distinct()
                .count();
        if (holders >= minHolders) {
            return Optional.empty();
        }
        return Optional.of(Finding.of(new RiskIndicator(
                SignalTypes.FEW_INITIAL_HOLDERS,
                SEVERITY,
                "Launch reached " + holders + " holders",
                event.signature()
        )));
    }
}
