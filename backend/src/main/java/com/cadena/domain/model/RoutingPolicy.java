/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.domain.model;

public enum RoutingPolicy {
    COST_OPTIMIZED,
    PERFORMANCE_FIRST,
    ROUND_ROBIN,
    WEIGHTED_ROUND_ROBIN,
    ENHANCED_DATA_FIRST
}
