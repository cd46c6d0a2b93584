/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner.timestamp;

import java.time.LocalTime;
import java.util.Optional;

/**
 * Recognizes one timestamp shape in a log line.
 */
public interface TimestampMatcher {
    /**
     * Looks for this matcher's timestamp shape in the line.
     *
     * @param line raw log line, without its terminator
     * @return the time of day normalized to nanoseconds, or empty if the shape is absent or out of range
     */
    Optional<LocalTime> match(String line);
}
