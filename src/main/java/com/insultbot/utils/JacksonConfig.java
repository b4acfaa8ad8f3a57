/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.utils;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared ObjectMapper for inbound Slack payloads. ObjectMapper is thread-safe
 * after configuration, so one instance serves every request thread.
 *
 * <p>Slack adds envelope fields without notice, so unknown properties are ignored.
 */
public final class JacksonConfig {

    private static final ObjectMapper INSTANCE = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JacksonConfig() {}

    /** Standard ObjectMapper for Slack envelope parsing. */
    public static ObjectMapper mapper() {
        return INSTANCE;
    }
}
