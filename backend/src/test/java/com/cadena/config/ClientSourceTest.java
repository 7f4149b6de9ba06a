/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena.config;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ClientSourceTest {

    @Test
    void prefersFirstForwardedAddress() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(ClientSource.FORWARDED_FOR, " 203.0.113.7 , 10.0.0.1");
        request.addHeader(ClientSource.REAL_IP, "198.51.100.2");

        assertEquals("203.0.113.7", ClientSource.of(request));
    }

    @Test
    void fallsBackToRealIpThenSocket() {
        MockHttpServletRequest withRealIp = new MockHttpServletRequest();
        withRealIp.addHeader(ClientSource.REAL_IP, "198.51.100.2");
        MockHttpServletRequest plain = new MockHttpServletRequest();
        plain.setRemoteAddr("192.0.2.9");

        assertEquals("198.51.100.2", ClientSource.of(withRealIp));
        assertEquals("192.0.2.9", ClientSource.of(plain));
    }
}
