/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.signals;

import com.cadena.domain.model.ChainEvent;

import java.util.Optional;

/**
 * A single, independent detection rule. New rules are added by declaring another bean.
 */
public interface SignalRule {
    String name();

    Optional<Finding> evaluate(ChainEvent event);
}
