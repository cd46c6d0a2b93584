/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner.exceptions;

import java.io.IOException;

/**
 * Thrown by the line reader when a single line grows past the maximum line length.
 */
public class LineTooLongException extends IOException {
    // custom serialVersionUID for class extends Serializable class
    private static final long serialVersionUID = 104;

    public LineTooLongException(String s) {
        super(s);
    }
}
