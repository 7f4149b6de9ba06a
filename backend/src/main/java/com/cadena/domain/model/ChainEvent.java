/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChainEvent(
        String signature,
        Long timestamp,
        String type,
        String source,
        Long slot,
        Long fee,
        String feePayer,
        List<NativeTransfer> nativeTransfers,
        List<TokenTransfer> tokenTransfers,
        List<Instruction> instructions,
        TokenMetadata tokenMetadata
) {
    public ChainEvent {
        nativeTransfers = nativeTransfers == null ? List.of() : List.copyOf(nativeTransfers);
        tokenTransfers = tokenTransfers == null ? List.of() : List.copyOf(tokenTransfers);
        instructions = instructions == null ? List.of() : List.copyOf(instructions);
    }

    public ChainEvent withTokenMetadata(TokenMetadata metadata) {
        return new ChainEvent(signature, timestamp, type, source, slot, fee, feePayer,
                nativeTransfers, tokenTransfers, instructions, metadata);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NativeTransfer(
            String fromUserAccount,
            String toUserAccount,
            long amount,
            BigDecimal usdValue
    ) {
        public boolean isSelfTransfer() {
            return fromUserAccount != null && fromUserAccount.equals(toUserAccount);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TokenTransfer(
            String fromUserAccount,
            String toUserAccount,
            BigDecimal tokenAmount,
            String mint,
            String tokenStandard,
            BigDecimal usdValue
    ) {
        public boolean isSelfTransfer() {
            return fromUserAccount != null && fromUserAccount.equals(toUserAccount);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Instruction(
            String programId,
            List<String> accounts,
            String data
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TokenMetadata(
            String mint,
            String name,
            String symbol,
            Integer decimals,
            String uri
    ) {
        public boolean isComplete() {
            return name != null && !name.isBlank() && symbol != null && !symbol.isBlank();
        }
    }
}
