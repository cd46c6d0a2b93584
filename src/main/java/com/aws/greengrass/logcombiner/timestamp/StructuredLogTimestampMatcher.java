/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner.timestamp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Reads the epoch milliseconds {@code timestamp} field of a JSON structured log line and returns its UTC time of
 * day.
 */
public class StructuredLogTimestampMatcher implements TimestampMatcher {
    private static final ObjectMapper DESERIALIZER = JsonMapper.builder()
            .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES, true)
            .build();

    @Override
    public Optional<LocalTime> match(String line) {
        String trimmed = line.trim();
        if (!trimmed.startsWith("{")) {
            return Optional.empty();
        }
        try {
            StructuredLogMessage message = DESERIALIZER.readValue(trimmed, StructuredLogMessage.class);
            if (message == null || message.getTimestamp() == null) {
                return Optional.empty();
            }
            return Optional.of(LocalTime.ofInstant(Instant.ofEpochMilli(message.getTimestamp()), ZoneOffset.UTC));
        } catch (JsonProcessingException ignored) {
            // Not a structured line, the text matchers have already had their turn.
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return "structured-json";
    }
}
