/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.infrastructure.provider;

public enum ProviderErrorType {
    TIMEOUT(false),
    CONNECTION(false),
    RATE_LIMITED(false),
    HTTP_5XX(false),
    HTTP_4XX(true),
    RPC_ERROR(true),
    UNKNOWN(true);

    private final boolean charged;

    ProviderErrorType(boolean charged) {
        this.charged = charged;
    }

    public boolean isCharged() {
        return charged;
    }
}
