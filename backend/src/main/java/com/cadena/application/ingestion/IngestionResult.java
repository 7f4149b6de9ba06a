/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.ingestion;

public record IngestionResult(
        int received,
        int processed,
        int duplicates,
        int failed,
        int dispatched
) {
    public boolean allDuplicates() {
        return received > 0 && duplicates == received;
    }
}
