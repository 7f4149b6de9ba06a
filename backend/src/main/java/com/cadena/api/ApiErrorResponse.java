/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.api;

public record ApiErrorResponse(
        String status,
        String code,
        String message,
        String requestId
) {}
