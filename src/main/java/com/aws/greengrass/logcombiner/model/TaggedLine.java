/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Value;

/**
 * One input line annotated with everything needed to place it in the merged output.
 */
@Builder
@Value
@Getter
public class TaggedLine {
    private SortKey sortKey;
    private String displayTime;
    private String provenanceTag;
    private String rawLine;
    /**
     * What ends up in the merged output: display time, padded provenance column and the raw line.
     */
    private String displayLine;
}
