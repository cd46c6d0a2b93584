/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner.exceptions;

import lombok.Getter;

/**
 * Reading a source failed after it was opened: a line was longer than the configured limit, the stream broke
 * mid-read, or the run was aborted while the source was still being read.
 */
public class SourceScanException extends LogCombinerException {
    // custom serialVersionUID for class extends Serializable class
    private static final long serialVersionUID = 103;

    @Getter
    private final boolean cancelled;

    public SourceScanException(String s, boolean cancelled) {
        super(s);
        this.cancelled = cancelled;
    }

    public SourceScanException(String s, Throwable e) {
        super(s, e);
        this.cancelled = false;
    }
}
