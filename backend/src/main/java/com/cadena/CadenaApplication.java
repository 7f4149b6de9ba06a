/*
 * Copyright (C) 2025 Cadena Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cadena;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class CadenaApplication {
    public static void main(String[] args) {
        SpringApplication.run(CadenaApplication.class, args);
    }
}
