/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.api.webhooks;

public record WebhookAcceptedResponse(
        String status,
        int received,
        int processed,
        int duplicates,
        int dispatched,
        String requestId
) {}
