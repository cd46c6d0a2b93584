/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner.timestamp;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches a {@code HH:MM:SS[.fraction]} time captured by group 1 of a precompiled pattern.
 */
public class RegexTimestampMatcher implements TimestampMatcher {
    private static final Logger logger = LoggerFactory.getLogger(RegexTimestampMatcher.class);
    private static final int NANO_DIGITS = 9;

    @Getter
    private final String name;
    @Getter
    private final Pattern pattern;
    @Getter
    private final TimestampPrecision precision;

    /**
     * Constructor.
     *
     * @param name      short name used in trace logging
     * @param regex     pattern whose first group captures the time text
     * @param precision number of fraction digits the pattern captures
     */
    public RegexTimestampMatcher(String name, String regex, TimestampPrecision precision) {
        this.name = name;
        this.pattern = Pattern.compile(regex);
        this.precision = precision;
    }

    @Override
    public Optional<LocalTime> match(String line) {
        Matcher matcher = pattern.matcher(line);
        // A shape with out of range fields, such as 99:99:99, does not count. Keep looking further along the line.
        while (matcher.find()) {
            Optional<LocalTime> time = toLocalTime(matcher.group(1));
            if (time.isPresent()) {
                return time;
            }
        }
        return Optional.empty();
    }

    private Optional<LocalTime> toLocalTime(String text) {
        int hour = Integer.parseInt(text.substring(0, 2));
        int minute = Integer.parseInt(text.substring(3, 5));
        int second = Integer.parseInt(text.substring(6, 8));
        int nanos = 0;
        if (precision != TimestampPrecision.SECONDS) {
            // Zero fill the missing lower order digits so every precision compares at nanosecond resolution.
            String fraction = text.substring(9, 9 + precision.getFractionDigits());
            nanos = Integer.parseInt(StringUtils.rightPad(fraction, NANO_DIGITS, '0'));
        }
        try {
            return Optional.of(LocalTime.of(hour, minute, second, nanos));
        } catch (DateTimeException e) {
            logger.atTrace().setCause(e).addKeyValue("matcher", name).log("Ignoring out of range time {}", text);
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
