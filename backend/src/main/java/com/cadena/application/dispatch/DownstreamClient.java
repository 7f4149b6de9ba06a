/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.dispatch;

import com.cadena.config.AppProperties;
import reactor.core.publisher.Mono;

public interface DownstreamClient {
    Mono<Void> deliver(AppProperties.Dispatch.Target target, DispatchEnvelope envelope);
}
