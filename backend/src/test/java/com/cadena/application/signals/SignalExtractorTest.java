/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.signals;

import com.cadena.application.signals.rules.LargeVolumeRule;
import com.cadena.application.signals.rules.MissingMetadataRule;
import com.cadena.application.signals.rules.NewTokenLaunchRule;
import com.cadena.application.signals.rules.WashTradingRule;
import com.cadena.config.AppProperties;
import com.cadena.domain.model.ChainEvent;
import com.cadena.domain.model.ExtractedSignal;
import com.cadena.domain.model.RiskIndicator;
import com.cadena.domain.model.WebhookEvent;
import com.cadena.support.TestProperties;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignalExtractorTest {
    private static final String ALICE = "AliceWa11et1111111111111111111111111111111";
    private static final String BOB = "BobWa11et11111111111111111111111111111111";

    private final AppProperties properties = TestProperties.defaults();
    private final TokenLaunches launches = new TokenLaunches(properties);
    private final SignalExtractor extractor = new SignalExtractor(List.of(
            new LargeVolumeRule(new UsdValuation(properties), properties),
            new NewTokenLaunchRule(launches),
            new WashTradingRule(),
            new MissingMetadataRule(launches)
    ));

    @Test
    void fiveThousandDollarTransferBetweenDistinctAccountsIsLargeVolume() {
        ChainEvent event = event("sigA", "TRANSFER",
                List.of(),
                List.of(usdc(ALICE, BOB, "5000")),
                List.of(), null);

        ExtractionResult result = extractor.extract(webhook(event));

        assertEquals(1, result.signals().size());
        ExtractedSignal signal = result.signals().get(0);
        assertEquals(SignalTypes.LARGE_VOLUME, signal.type());
        assertTrue(signal.strength() > 0);
        assertTrue(signal.confidence() >= 0.7);
        assertEquals(new BigDecimal("5000.00"), signal.metadata().get("usdValue"));
        assertEquals("sigA", signal.eventSignature());
        assertTrue(result.risks().isEmpty());
    }

    @Test
    void nativeTransfersAreValuedAtTheReferencePrice() {
        // 40 SOL at 150 USD
        ChainEvent event = event("sigSol", "TRANSFER",
                List.of(new ChainEvent.NativeTransfer(ALICE, BOB, 40_000_000_000L, null)),
                List.of(), List.of(), null);

        ExtractedSignal signal = extractor.extract(webhook(event)).signals().get(0);

        assertEquals(new BigDecimal("6000.00"), signal.metadata().get("usdValue"));
        assertEquals(LargeVolumeRule.NATIVE_MINT, signal.metadata().get("mint"));
        assertEquals(0.06, signal.strength(), 1e-9);
    }

    @Test
    void selfTransferIsWashTradingAndNotLargeVolume() {
        ChainEvent event = event("sigB", "TRANSFER",
                List.of(),
                List.of(usdc(ALICE, ALICE, "1000000")),
                List.of(), null);

        ExtractionResult result = extractor.extract(webhook(event));

        assertTrue(result.signals().isEmpty());
        assertEquals(1, result.risks().size());
        RiskIndicator risk = result.risks().get(0);
        assertEquals(SignalTypes.WASH_TRADING, risk.type());
        assertTrue(risk.severity() >= 0.5);
        assertTrue(risk.description().contains(ALICE));
    }

    @Test
    void amountsAtOrBelowThresholdAreIgnored() {
        ChainEvent event = event("sigSmall", "TRANSFER",
                List.of(), List.of(usdc(ALICE, BOB, "1000")), List.of(), null);

        assertTrue(extractor.extract(webhook(event)).isEmpty());
    }

    @Test
    void unpricedTokensAreNotValued() {
        ChainEvent.TokenTransfer unknown = new ChainEvent.TokenTransfer(ALICE, BOB, new BigDecimal("99999999"),
                "UnknownMint111111111111111111111111111111", "Fungible", null);
        ChainEvent event = event("sigUnknown", "TRANSFER", List.of(), List.of(unknown), List.of(), null);

        assertTrue(extractor.extract(webhook(event)).isEmpty());
    }

    @Test
    void listingWithoutMetadataIsLaunchPlusMissingMetadataRisk() {
        ChainEvent.Instruction listing = new ChainEvent.Instruction(
                AppProperties.Signals.PUMP_FUN_PROGRAM, List.of("NewMint1111111111111111111111111111111111"), "");
        ChainEvent event = event("sigLaunch", "CREATE", List.of(), List.of(), List.of(listing), null);

        ExtractionResult result = extractor.extract(webhook(event));

        assertEquals(1, result.signals().size());
        ExtractedSignal launch = result.signals().get(0);
        assertEquals(SignalTypes.NEW_TOKEN_LAUNCH, launch.type());
        assertEquals("NewMint1111111111111111111111111111111111", launch.metadata().get("mint"));
        assertEquals(1, result.risks().size());
        assertEquals(SignalTypes.MISSING_METADATA, result.risks().get(0).type());
    }

    @Test
    void listingWithCompleteMetadataHasNoRisk() {
        ChainEvent.Instruction listing = new ChainEvent.Instruction(AppProperties.Signals.PUMP_FUN_PROGRAM, List.of(), "");
        ChainEvent.TokenMetadata metadata = new ChainEvent.TokenMetadata("Mint2", "Cadena Coin", "CDN", 6, null);
        ChainEvent event = event("sigLaunch2", "CREATE", List.of(), List.of(), List.of(listing), metadata);

        ExtractionResult result = extractor.extract(webhook(event));

        assertEquals(1, result.signals().size());
        assertEquals("CDN", result.signals().get(0).metadata().get("symbol"));
        assertTrue(result.risks().isEmpty());
    }

    @Test
    void failingRuleDoesNotStopTheOthers() {
        SignalRule broken = new SignalRule() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public Optional<Finding> evaluate(ChainEvent event) {
                throw new IllegalStateException("boom");
            }
        };
        SignalExtractor withBroken = new SignalExtractor(List.of(broken, new WashTradingRule()));
        ChainEvent event = event("sigC", "TRANSFER",
                List.of(new ChainEvent.NativeTransfer(BOB, BOB, 1, null)), List.of(), List.of(), null);

        ExtractionResult result = withBroken.extract(webhook(event));

        assertEquals(1, result.risks().size());
    }

    private static ChainEvent.TokenTransfer usdc(String from, String to, String amount) {
        return new ChainEvent.TokenTransfer(from, to, new BigDecimal(amount), AppProperties.Signals.USDC_MINT, "Fungible", null);
    }

    private static ChainEvent event(
            String signature,
            String type,
            List<ChainEvent.NativeTransfer> nativeTransfers,
            List<ChainEvent.TokenTransfer> tokenTransfers,
            List<ChainEvent.Instruction> instructions,
            ChainEvent.TokenMetadata metadata
    ) {
        return new ChainEvent(signature, 1_700_000_000L, type, "SYSTEM_PROGRAM", 250_000_000L, 5000L, ALICE,
                nativeTransfers, tokenTransfers, instructions, metadata);
    }

    private static WebhookEvent webhook(ChainEvent event) {
        return new WebhookEvent(event.signature(), "helius", Instant.parse("2025-01-01T00:00:00Z"), "{}", true, event);
    }
}
