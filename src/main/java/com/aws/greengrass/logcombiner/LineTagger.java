/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner;

import com.aws.greengrass.logcombiner.model.SortKey;
import com.aws.greengrass.logcombiner.model.TaggedLine;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalTime;

/**
 * Builds the sort key and the display form of each line.
 */
public class LineTagger {
    public static final int MAX_TAG_LENGTH = 60;
    public static final int TAG_HEAD_LENGTH = 17;
    public static final int TAG_TAIL_LENGTH = 40;
    public static final String ELLIPSIS = "...";
    // Two brackets around the longest tag.
    public static final int PROVENANCE_COLUMN_WIDTH = MAX_TAG_LENGTH + 2;

    /**
     * Shortens deeply nested source names so the provenance column stays aligned: names longer than
     * {@link #MAX_TAG_LENGTH} keep their first {@link #TAG_HEAD_LENGTH} and last {@link #TAG_TAIL_LENGTH}
     * characters around an ellipsis.
     *
     * @param displayName source name with the listing prefix removed
     * @return the provenance tag
     */
    public static String shortName(String displayName) {
        if (displayName.length() > MAX_TAG_LENGTH) {
            return displayName.substring(0, TAG_HEAD_LENGTH) + ELLIPSIS
                    + displayName.substring(displayName.length() - TAG_TAIL_LENGTH);
        }
        return displayName;
    }

    public static String displayTime(LocalTime time) {
        return String.format("%02d:%02d:%02d.%09d", time.getHour(), time.getMinute(), time.getSecond(),
                time.getNano());
    }

    /**
     * Tags one line.
     *
     * @param dayNumber     0, or 1 once the source has rolled past midnight
     * @param time          time of the line
     * @param sourceIndex   index of the source in the listing
     * @param rowNumber     1-based line number within the source
     * @param provenanceTag shortened source name
     * @param rawLine       the line as read
     * @return the tagged line
     */
    public TaggedLine tag(int dayNumber, LocalTime time, int sourceIndex, long rowNumber, String provenanceTag,
                          String rawLine) {
        String displayTime = displayTime(time);
        String displayLine = displayTime + " "
                + StringUtils.rightPad("[" + provenanceTag + "]", PROVENANCE_COLUMN_WIDTH) + " " + rawLine;
        return TaggedLine.builder()
                .sortKey(SortKey.of(dayNumber, time, sourceIndex, rowNumber))
                .displayTime(displayTime)
                .provenanceTag(provenanceTag)
                .rawLine(rawLine)
                .displayLine(displayLine)
                .build();
    }
}
