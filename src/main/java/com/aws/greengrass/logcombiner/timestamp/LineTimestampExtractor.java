/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner.timestamp;

import com.aws.greengrass.logcombiner.util.LogCombinerConfig;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Finds the time of day of a log line by trying an ordered list of matchers. Matchers anchored at the start of
 * the line come first so that a proper prefix wins over an unrelated time shaped number later in the line, and
 * more precise shapes are tried before less precise ones.
 */
public class LineTimestampExtractor {
    private static final String HMS = "\\d{2}:\\d{2}:\\d{2}";
    private static final String KLOG_PREFIX = "^[A-Za-z]\\d{4}\\s+";
    private static final String SYSLOG_PREFIX =
            "^(?:Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)\\s+\\d{1,2}\\s+";

    private final List<TimestampMatcher> matchers;

    public LineTimestampExtractor(List<TimestampMatcher> matchers) {
        this.matchers = Collections.unmodifiableList(new ArrayList<>(matchers));
    }

    /**
     * Creates an extractor with the default matchers, plus the structured JSON matcher when it is enabled.
     *
     * @param config combiner configuration
     * @return the extractor
     */
    public static LineTimestampExtractor create(LogCombinerConfig config) {
        List<TimestampMatcher> matchers = new ArrayList<>(defaultMatchers());
        if (config.isStructuredTimestampsEnabled()) {
            matchers.add(new StructuredLogTimestampMatcher());
        }
        return new LineTimestampExtractor(matchers);
    }

    /**
     * The text matchers, most specific first.
     */
    public static List<TimestampMatcher> defaultMatchers() {
        List<TimestampMatcher> matchers = new ArrayList<>();
        // I0101 22:10:34.002031
        matchers.add(new RegexTimestampMatcher("klog-micro",
                KLOG_PREFIX + "(" + HMS + "\\.\\d{6})(?!\\d)", TimestampPrecision.MICROSECONDS));
        matchers.add(new RegexTimestampMatcher("klog-milli",
                KLOG_PREFIX + "(" + HMS + "\\.\\d{3})(?!\\d)", TimestampPrecision.MILLISECONDS));
        // Jan  1 22:10:34.002031
        matchers.add(new RegexTimestampMatcher("syslog-micro",
                SYSLOG_PREFIX + "(" + HMS + "\\.\\d{6})(?!\\d)", TimestampPrecision.MICROSECONDS));
        matchers.add(new RegexTimestampMatcher("syslog-milli",
                SYSLOG_PREFIX + "(" + HMS + "\\.\\d{3})(?!\\d)", TimestampPrecision.MILLISECONDS));
        // time="2020-01-01T22:10:34.002031939Z"
        matchers.add(new RegexTimestampMatcher("structured-field",
                "time=\"\\d{4}-\\d{2}-\\d{2}T(" + HMS + "\\.\\d{9})Z", TimestampPrecision.NANOSECONDS));
        matchers.add(new RegexTimestampMatcher("nano", "(" + HMS + "\\.\\d{9})", TimestampPrecision.NANOSECONDS));
        matchers.add(new RegexTimestampMatcher("micro", "(" + HMS + "\\.\\d{6})", TimestampPrecision.MICROSECONDS));
        matchers.add(new RegexTimestampMatcher("milli", "(" + HMS + "\\.\\d{3})", TimestampPrecision.MILLISECONDS));
        matchers.add(new RegexTimestampMatcher("seconds", "(" + HMS + ")", TimestampPrecision.SECONDS));
        return matchers;
    }

    /**
     * Returns the time found by the first matcher that recognizes the line.
     *
     * @param line raw log line
     * @return the time, or empty if no matcher recognizes the line
     */
    public Optional<LocalTime> find(String line) {
        for (TimestampMatcher matcher : matchers) {
            Optional<LocalTime> time = matcher.match(line);
            if (time.isPresent()) {
                return time;
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the time of the line, or the fallback when the line carries no recognizable time. Never fails.
     *
     * @param line     raw log line
     * @param fallback time of the previous line of the same source
     * @return the time of the line
     */
    public LocalTime extract(String line, LocalTime fallback) {
        return find(line).orElse(fallback);
    }

    List<TimestampMatcher> getMatchers() {
        return matchers;
    }
}
