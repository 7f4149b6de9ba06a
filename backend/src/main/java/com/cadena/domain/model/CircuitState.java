/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.domain.model;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN;

    public boolean admitsCalls() {
        return this != OPEN;
    }
}
