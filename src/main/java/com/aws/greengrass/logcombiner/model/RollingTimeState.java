/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner.model;

import lombok.Getter;

import java.time.LocalTime;

/**
 * Time state carried from line to line while a single source is read.
 */
@Getter
public class RollingTimeState {
    public static final LocalTime ZERO_TIME = LocalTime.MIDNIGHT;

    private LocalTime currentTime = ZERO_TIME;
    // Stays null until a line of the source yields a time, which may itself be midnight.
    private LocalTime firstTime;
    private int dayNumber;

    /**
     * Records the time found in the next line. Once a line's hour is more than one hour before the hour of the
     * first time found, the source is assumed to have crossed midnight and the day number stays 1 for the rest
     * of it. Lines without a time of their own do not advance the state.
     *
     * @param lineTime time extracted from the line
     */
    public void advance(LocalTime lineTime) {
        currentTime = lineTime;
        if (firstTime == null) {
            firstTime = lineTime;
        }
        if (lineTime.getHour() < firstTime.getHour() - 1) {
            dayNumber = 1;
        }
    }

    public boolean hasRolledOver() {
        return dayNumber > 0;
    }
}
