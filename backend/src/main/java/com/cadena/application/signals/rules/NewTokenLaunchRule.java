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
import com.cadena.domain.model.ExtractedSignal;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

@Component
@Order(20)
public class NewTokenLaunchRule implements SignalRule {
    static final double STRENGTH = 0.6;
    static final double CONFIDENCE = 0.9;

    private final TokenLaunches launches;

    public NewTokenLaunchRule(TokenLaunches launches) {
        this.launches = launches;
    }

    @Override
    public String name() {
        return SignalTypes.NEW_TOKEN_LAUNCH;
    }

    @Override
    public Optional<Finding> evaluate(ChainEvent event) {
        return launches.listingInstruction(event).map(instruction -> {
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("programId", instruction.programId());
            launches.launchedMint(event).ifPresent(mint -> metadata.put("mint", mint));
            if (event.tokenMetadata() != null && event.tokenMetadata().symbol() != null) {
                metadata.put("symbol", event.tokenMetadata().symbol());
            }
            return Finding.of(new ExtractedSignal(
                    SignalTypes.NEW_TOKEN_LAUNCH,
                    STRENGTH,
                    CONFIDENCE,
                    metadata,
                    event.signature()
            ));
        });
    }
}
