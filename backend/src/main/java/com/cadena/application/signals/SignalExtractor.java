/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.signals;

import com.cadena.domain.model.ExtractedSignal;
import com.cadena.domain.model.RiskIndicator;
import com.cadena.domain.model.WebhookEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs every {@link SignalRule} against an event. A rule that throws is skipped and logged;
 * the remaining rules still run.
 */
@Service
public class SignalExtractor {
    private static final Logger log = LoggerFactory.getLogger(SignalExtractor.class);

    private final List<SignalRule> rules;

    public SignalExtractor(List<SignalRule> rules) {
        this.rules = List.copyOf(rules);
        log.info("Signal rules: {}", this.rules.stream().map(SignalRule::name).toList());
    }

    public ExtractionResult extract(WebhookEvent event) {
        List<ExtractedSignal> signals = new ArrayList<>();
        List<RiskIndicator> risks = new ArrayList<>();
        for (SignalRule rule : rules) {
            Optional<Finding> finding;
            try {
                finding = rule.evaluate(event.event());
            } catch (RuntimeException e) {
                log.error("Signal rule {} failed signature={}", rule.name(), event.signature(), e);
                continue;
            }
            finding.ifPresent(f -> {
                if (f.signal() != null) signals.add(f.signal());
                if (f.risk() != null) risks.add(f.risk());
            });
        }
        return new ExtractionResult(signals, risks);
    }
}
