/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner.exceptions;

/**
 * Base class for every failure that terminates a combine run.
 */
public class LogCombinerException extends Exception {
    // custom serialVersionUID for class extends Serializable class
    private static final long serialVersionUID = 100;

    public LogCombinerException(String s) {
        super(s);
    }

    public LogCombinerException(String s, Throwable e) {
        super(s, e);
    }
}
