/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner.exceptions;

public class EnumerationException extends LogCombinerException {
    // custom serialVersionUID for class extends Serializable class
    private static final long serialVersionUID = 101;

    public EnumerationException(String s) {
        super(s);
    }

    public EnumerationException(String s, Throwable e) {
        super(s, e);
    }
}
