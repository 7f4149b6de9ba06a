/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.application.ingestion;

import com.cadena.api.ApiException;
import com.cadena.config.AppProperties;
import com.cadena.support.TestProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebhookPayloadParserTest {
    private final WebhookPayloadParser parser = new WebhookPayloadParser(new ObjectMapper(),
            TestProperties.builder().webhook(new AppProperties.Webhook("s", null, null, null, 2)).build());

    @Test
    void parsesBareArrayAndKeepsRawEvent() {
        List<ParsedEvent> events = parser.parse("""
                [{"signature":"sig1","timestamp":1700000000,"type":"TRANSFER","unknownField":{"x":1},
                  "nativeTransfers":[{"fromUserAccount":"A","toUserAccount":"B","amount":5}]}]
                """);

        assertEquals(1, events.size());
        assertEquals("sig1", events.get(0).event().signature());
        assertEquals(5, events.get(0).event().nativeTransfers().get(0).amount());
        assertTrue(events.get(0).rawJson().contains("unknownField"));
    }

    @Test
    void acceptsEventsEnvelope() {
        List<ParsedEvent> events = parser.parse("{\"events\":[{\"signature\":\"s\",\"timestamp\":1}]}");

        assertEquals(1, events.size());
        assertTrue(events.get(0).event().tokenTransfers().isEmpty());
    }

    @Test
    void rejectsMalformedPayloads() {
        assertInvalid("");
        assertInvalid("not json");
        assertInvalid("{\"signature\":\"s\",\"timestamp\":1}");
        assertInvalid("[]");
        assertInvalid("[1]");
        assertInvalid("[{\"timestamp\":1}]");
        assertInvalid("[{\"signature\":\"  \",\"timestamp\":1}]");
        assertInvalid("[{\"signature\":\"s\"}]");
        assertInvalid("[{\"signature\":\"s\",\"timestamp\":\"yesterday\"}]");
        assertInvalid("[{\"signature\":\"s\",\"timestamp\":-5}]");
    }

    @Test
    void capsBatchSize() {
        ApiException e = assertInvalid("""
                [{"signature":"a","timestamp":1},{"signature":"b","timestamp":1},{"signature":"c","timestamp":1}]
                """);

        assertTrue(e.getMessage().contains("max 2"));
    }

    private ApiException assertInvalid(String body) {
        ApiException e = assertThrows(ApiException.class, () -> parser.parse(body));
        assertEquals(HttpStatus.BAD_REQUEST, e.getStatus());
        assertEquals(WebhookPayloadParser.INVALID_PAYLOAD, e.getCode());
        return e;
    }
}
