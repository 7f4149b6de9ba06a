/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.signals;

import com.cadena.config.AppProperties;
import com.cadena.domain.model.ChainEvent;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

@Component
public class TokenLaunches {
    private static final Set<String> LAUNCH_TYPES = Set.of("TOKEN_MINT", "CREATE");

    private final Set<String> newListingPrograms;

    public TokenLaunches(AppProperties properties) {
        this.newListingPrograms = Set.copyOf(properties.signals().newListingPrograms());
    }

    public Optional<ChainEvent.Instruction> listingInstruction(ChainEvent event) {
        return event.instructions().stream()
                .filter(i -> i.programId() != null && newListingPrograms.contains(i.programId()))
                .findFirst();
    }

    public boolean isLaunch(ChainEvent event) {
        return listingInstruction(event).isPresent()
                || (event.type() != null && LAUNCH_TYPES.contains(event.type()));
    }

    public Optional<String> launchedMint(ChainEvent event) {
        if (event.tokenMetadata() != null && event.tokenMetadata().mint() != null) {
            return Optional.of(event.tokenMetadata().mint());
        }
        Optional<String> fromTransfer = event.tokenTransfers().stream()
                .map(ChainEvent.TokenTransfer::mint)
                .filter(m -> m != null && !m.isBlank())
                .findFirst();
        if (fromTransfer.isPresent()) {
            return fromTransfer;
        }
        return listingInstruction(event)
                .filter(i -> i.accounts() != null && !i.accounts().isEmpty())
                .map(i -> i.accounts().get(0));
    }
}
