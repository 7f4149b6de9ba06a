/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.ingestion;

import com.cadena.api.ApiException;
import com.cadena.config.AppProperties;
import com.cadena.domain.model.ChainEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses and structurally validates a webhook body.
 * Accepts a JSON array of events or an object carrying an {@code events} array.
 */
@Component
public class WebhookPayloadParser {
    static final String INVALID_PAYLOAD = "INVALID_PAYLOAD";

    private final ObjectMapper objectMapper;
    private final int maxEvents;

    public WebhookPayloadParser(ObjectMapper objectMapper, AppProperties properties) {
        this.objectMapper = objectMapper;
        this.maxEvents = properties.webhook().maxEventsPerPayload();
    }

    public List<ParsedEvent> parse(String body) {
        if (body == null || body.isBlank()) {
            throw invalid("Empty payload");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw invalid("Payload is not valid JSON");
        }

        JsonNode events;
        if (root.isArray()) {
            events = root;
        } else if (root.isObject() && root.path("events").isArray()) {
            events = root.get("events");
        } else {
            throw invalid("Payload must be an array of events or an object with an events array");
        }

        if (events.isEmpty()) {
            throw invalid("Empty event batch");
        }
        if (events.size() > maxEvents) {
            throw invalid("Too many events in one payload (max " + maxEvents + ")");
        }

        List<ParsedEvent> out = new ArrayList<>(events.size());
        for (int i = 0; i < events.size(); i++) {
            JsonNode node = events.get(i);
            validate(i, node);
            try {
                out.add(new ParsedEvent(objectMapper.treeToValue(node, ChainEvent.class), node.toString()));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw invalid("Event[" + i + "] has an invalid structure");
            }
        }
        return out;
    }

    private static void validate(int index, JsonNode node) {
        if (!node.isObject()) {
            throw invalid("Event[" + index + "] must be an object");
        }
        JsonNode signature = node.get("signature");
        if (signature == null || !signature.isTextual() || signature.asText().isBlank()) {
            throw invalid("Event[" + index + "] is missing a signature");
        }
        JsonNode timestamp = node.get("timestamp");
        if (timestamp == null || !timestamp.isNumber() || !timestamp.canConvertToLong() || timestamp.asLong() <= 0) {
            throw invalid("Event[" + index + "] needs a positive numeric timestamp");
        }
    }

    private static ApiException invalid(String message) {
        return new ApiException(HttpStatus.BAD_REQUEST, INVALID_PAYLOAD, message);
    }
}
