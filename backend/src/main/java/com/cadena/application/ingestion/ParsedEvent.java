/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.ingestion;

import com.cadena.domain.model.ChainEvent;

public record ParsedEvent(ChainEvent event, String rawJson) {}
