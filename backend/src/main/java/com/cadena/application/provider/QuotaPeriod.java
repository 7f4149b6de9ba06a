/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.provider;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

public enum QuotaPeriod {
    CALENDAR_MONTH_UTC {
        @Override
        public Instant initialStart(Instant now) {
            LocalDate first = now.atZone(ZoneOffset.UTC).toLocalDate().withDayOfMonth(1);
            return first.atStartOfDay(ZoneOffset.UTC).toInstant();
        }

        @Override
        public Instant currentStart(Instant start, Instant now) {
            Instant candidate = initialStart(now);
            return candidate.isAfter(start) ? candidate : start;
        }

        @Override
        public Duration length(Instant start) {
            ZonedDateTime from = start.atZone(ZoneOffset.UTC);
            return Duration.between(from, from.plusMonths(1));
        }
    },
    ROLLING_30_DAYS {
        private static final Duration PERIOD = Duration.ofDays(30);

        @Override
        public Instant initialStart(Instant now) {
            return now;
        }

        @Override
        public Instant currentStart(Instant start, Instant now) {
            if (now.isBefore(start.plus(PERIOD))) return start;
            long elapsedPeriods = Duration.between(start, now).toMillis() / PERIOD.toMillis();
            return start.plus(PERIOD.multipliedBy(elapsedPeriods));
        }

        @Override
        public Duration length(Instant start) {
            return PERIOD;
        }
    };

    public abstract Instant initialStart(Instant now);

    /**
     * Start of the period containing {@code now}, given the currently tracked {@code start}.
     * Returns {@code start} unchanged while no boundary was crossed, including when the clock moved backwards.
     */
    public abstract Instant currentStart(Instant start, Instant now);

    public abstract Duration length(Instant start);
}
