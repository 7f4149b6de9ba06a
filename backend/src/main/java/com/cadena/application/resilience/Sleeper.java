/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.resilience;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
    void sleep(Duration delay) throws InterruptedException;

    static Sleeper threadSleeper() {
        return delay -> Thread.sleep(delay.toMillis());
    }
}
