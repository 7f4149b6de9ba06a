/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.routing;

public interface ProviderHealthReader {
    ProviderSnapshot getSnapshot(String providerId);
}
