/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Value;

/**
 * One discovered log file or object. The index is its position in the listing and is used to break ties
 * between lines from different sources that carry the same time.
 */
@Builder
@Value
@Getter
public class LogSource {
    private int index;
    private String name;
    private String displayName;
}
