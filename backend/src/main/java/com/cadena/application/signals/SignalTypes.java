/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.signals;

public final class SignalTypes {
    private SignalTypes() {}

    public static final String LARGE_VOLUME = "large_volume";
    public static final String NEW_TOKEN_LAUNCH = "new_token_launch";

    public static final String WASH_TRADING = "wash_trading";
    public static final String MISSING_METADATA = "missing_metadata";
    public static final String HIGH_TRANSACTION_FEE = "high_transaction_fee";
    public static final String LARGE_INITIAL_MINT = "large_initial_mint";
    public static final String LOW_INITIAL_LIQUIDITY = "low_initial_liquidity";
    public static final String FEW_INITIAL_HOLDERS = "few_initial_holders";
}
