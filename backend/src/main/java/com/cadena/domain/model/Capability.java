/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.domain.model;

public enum Capability {
    ENHANCED_METADATA,
    PUSH_NOTIFICATIONS
}
