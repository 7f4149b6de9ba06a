/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.gateway;

public enum GatewayResultStatus {
    SUCCESS,
    DEGRADED,
    ERROR
}
