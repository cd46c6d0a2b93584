/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Builder
@Value
@Getter
public class SourceListing {
    @Singular
    private List<String> names;
    /**
     * Common root removed from every name before it is shown in the provenance tag.
     */
    @Builder.Default
    private String prefix = "";
}
