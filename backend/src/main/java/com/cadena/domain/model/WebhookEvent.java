/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.domain.model;

import java.time.Instant;

public record WebhookEvent(
        String signature,
        String provider,
        Instant receivedAt,
        String rawJson,
        boolean authenticated,
        ChainEvent event
) {
    public WebhookEvent withEvent(ChainEvent enriched) {
        return new WebhookEvent(signature, provider, receivedAt, rawJson, authenticated, enriched);
    }
}
