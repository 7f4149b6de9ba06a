/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.provider;

public enum UsageDecision {
    ACCEPTED,
    OVER_QUOTA,
    RATE_LIMITED;

    public boolean accepted() {
        return this == ACCEPTED;
    }
}
