/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner.model;

import lombok.Value;

import java.time.LocalTime;
import java.util.Comparator;

/**
 * Total order over every line of a run: day number, wall clock time down to the nanosecond, source index and
 * finally row number. The (sourceIndex, rowNumber) pair is unique per line, so no two keys of a run are equal.
 */
@Value
public class SortKey implements Comparable<SortKey> {
    /**
     * Length of {@link #toString()} for source indexes up to 9999 and row numbers up to 99999999.
     */
    public static final int FORMATTED_LENGTH = 34;
    private static final Comparator<SortKey> ORDER = Comparator.comparingInt(SortKey::getDayNumber)
            .thenComparingInt(SortKey::getHour)
            .thenComparingInt(SortKey::getMinute)
            .thenComparingInt(SortKey::getSecond)
            .thenComparingInt(SortKey::getNanos)
            .thenComparingInt(SortKey::getSourceIndex)
            .thenComparingLong(SortKey::getRowNumber);

    private int dayNumber;
    private int hour;
    private int minute;
    private int second;
    private int nanos;
    private int sourceIndex;
    private long rowNumber;

    public static SortKey of(int dayNumber, LocalTime time, int sourceIndex, long rowNumber) {
        return new SortKey(dayNumber, time.getHour(), time.getMinute(), time.getSecond(), time.getNano(),
                sourceIndex, rowNumber);
    }

    @Override
    public int compareTo(SortKey other) {
        return ORDER.compare(this, other);
    }

    /**
     * Fixed width form, for example {@code 0:22:10:34.002031000:0003:00000042}. Plain string comparison of two
     * formatted keys agrees with {@link #compareTo(SortKey)} as long as both fit {@link #FORMATTED_LENGTH}.
     */
    @Override
    public String toString() {
        return String.format("%d:%02d:%02d:%02d.%09d:%04d:%08d", dayNumber, hour, minute, second, nanos,
                sourceIndex, rowNumber);
    }
}
