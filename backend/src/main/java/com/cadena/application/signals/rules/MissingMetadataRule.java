/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.signals.rules;

import com.cadena.application.signals.Finding;
import com.cadena.application.signals.SignalRule;
import com.cadena.application.signals.SignalTypes;
import com.cadena.application.signals.TokenLaunches;
import com.cadena.domain.model.ChainEvent;
import com.cadena.domain.model.RiskIndicator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@Order(40)
public class MissingMetadataRule implements SignalRule {
    static final double SEVERITY = 0.3;

    private final TokenLaunches launches;

    public MissingMetadataRule(TokenLaunches launches) {
        this.launches = launches;
    }

    @Override
    public String name() {
        return SignalTypes.MISSING_METADATA;
    }

    @Override
    public Optional<Finding> evaluate(ChainEvent event) {
        if (!launches.isLaunch(event)) {
            return Optional.empty();
        }
        if (event.tokenMetadata() != null && event.tokenMetadata().isComplete()) {
            return Optional.empty();
        }
        String mint = launches.launchedMint(event).orElse("unknown");
        return Optional.of(Finding.of(new RiskIndicator(
                SignalTypes.MISSING_METADATA,
                SEVERITY,
                "Token " + mint + " launched without name or symbol",
                event.signature()
        )));
    }
}
