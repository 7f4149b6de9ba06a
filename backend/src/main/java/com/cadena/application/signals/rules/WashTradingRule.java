/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.signals.rules;

import com.cadena.application.signals.Finding;
import com.cadena.application.signals.SignalRule;
import com.cadena.application.signals.SignalTypes;
import com.cadena.domain.model.ChainEvent;
import com.cadena.domain.model.RiskIndicator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.stream.Stream;

@Component
@Order(30)
public class WashTradingRule implements SignalRule {
    static final double SEVERITY = 0.7;

    @Override
    public String name() {
        return SignalTypes.WASH_TRADING;
    }

    @Override
    public Optional<Finding> evaluate(ChainEvent event) {
        Optional<String> account = Stream.concat(
                        event.nativeTransfers().stream()
                                .filter(ChainEvent.NativeTransfer::isSelfTransfer)
                                .map(ChainEvent.NativeTransfer::fromUserAccount),
                        event.tokenTransfers().stream()
                                .filter(ChainEvent.TokenTransfer::isSelfTransfer)
                                .map(ChainEvent.TokenTransfer::fromUserAccount))
                .findFirst();
        return account.map(a -> Finding.of(new RiskIndicator(
                SignalTypes.WASH_TRADING,
                SEVERITY,
                "Transfer with identical sender and receiver " + a,
                event.signature()
        )));
    }
}
