/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.signals;

import com.cadena.config.AppProperties;
import com.cadena.domain.model.ChainEvent;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Map;
import java.util.Optional;

/**
 * USD value of a transfer: the provider's own {@code usdValue}, else a configured reference price.
 * An empty result means the value is unknown.
 */
@Component
public class UsdValuation {
    static final BigDecimal LAMPORTS_PER_SOL = new BigDecimal("1000000000");

    private final BigDecimal solUsdPrice;
    private final Map<String, BigDecimal> tokenUsdPrices;

    public UsdValuation(AppProperties properties) {
        this.solUsdPrice = properties.signals().solUsdPrice();
        this.tokenUsdPrices = properties.signals().tokenUsdPrices();
    }

    public Optional<BigDecimal> valueOf(ChainEvent.NativeTransfer transfer) {
        if (transfer.usdValue() != null) {
            return Optional.of(transfer.usdValue());
        }
        BigDecimal sol = BigDecimal.valueOf(transfer.amount()).divide(LAMPORTS_PER_SOL, MathContext.DECIMAL64);
        return Optional.of(sol.multiply(solUsdPrice));
    }

    public Optional<BigDecimal> valueOf(ChainEvent.TokenTransfer transfer) {
        if (transfer.usdValue() != null) {
            return Optional.of(transfer.usdValue());
        }
        if (transfer.tokenAmount() == null || transfer.mint() == null) {
            return Optional.empty();
        }
        BigDecimal price = tokenUsdPrices.get(transfer.mint());
        return price == null ? Optional.empty() : Optional.of(transfer.tokenAmount().multiply(price));
    }
}
