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
@Order(60)
public class LargeInitialMintRule implements SignalRule {
    static final double SEVERITY = 0.3;

    private final TokenLaunches launches;
    private final BigDecimal largeMintAmount;

    public LargeInitialMintRule(TokenLaunches launches, AppProperties properties) {
        this.launches = launches;
        this.largeMintAmount = properties.signals().launchRisk().largeMintAmount();
    }

    @Override
    public String name() {
        return SignalTypes.LARGE_INITIAL_MINT;
    }

    @Override
    public Optional<Finding> evaluate(ChainEvent event) {
        if (!launches.isLaunch(event)) {
            return Optional.empty();
        }
        return event.tokenTransfers().stream()
                .filter(t -> t.tokenAmount() != null && t.tokenAmount().compareTo(largeMintAmount) > 0)
                .findFirst()
                .map(t -> Finding.of(new RiskIndicator(
                        SignalTypes.LARGE_INITIAL_MINT,
                        SEVERITY,
                        t.tokenAmount().toPlainString() + " tokens minted to " + t.toUserAccount(),
                        event.signature()
                )));
    }
}
