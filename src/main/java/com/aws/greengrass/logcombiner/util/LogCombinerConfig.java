/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner.util;

import ch.qos.logback.core.util.FileSize;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.UnaryOperator;

/**
 * Combiner settings. Each option is read from a JVM system property first, then from the environment variable
 * of the same name.
 */
@Getter
public class LogCombinerConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(LogCombinerConfig.class);

    static final String MAX_LINE_SIZE = "LOG_COMBINER_MAX_LINE_SIZE";
    static final String MAX_LINE_SIZE_DEFAULT_VALUE = "32MB";
    static final String BUCKET = "LOG_COMBINER_BUCKET";
    static final String BUCKET_DEFAULT_VALUE = "kubernetes-jenkins";
    static final String OBJECT_STORE_ENDPOINT = "LOG_COMBINER_OBJECT_STORE_ENDPOINT";
    static final String OBJECT_STORE_ENDPOINT_DEFAULT_VALUE = "https://storage.googleapis.com";
    static final String OBJECT_STORE_REGION = "LOG_COMBINER_OBJECT_STORE_REGION";
    static final String OBJECT_STORE_REGION_DEFAULT_VALUE = "us-east-1";
    static final String STRUCTURED_TIMESTAMPS = "LOG_COMBINER_STRUCTURED_TIMESTAMPS";
    static final boolean STRUCTURED_TIMESTAMPS_DEFAULT_VALUE = false;

    private final int maxLineLength;
    private final String bucketName;
    private final String objectStoreEndpoint;
    private final String objectStoreRegion;
    private final boolean structuredTimestampsEnabled;

    public LogCombinerConfig() {
        this(LogCombinerConfig::getValue);
    }

    /**
     * Constructor.
     *
     * @param lookup resolves an option name to its raw value, or null when it is not set
     */
    public LogCombinerConfig(UnaryOperator<String> lookup) {
        this.maxLineLength = getSizeValue(lookup.apply(MAX_LINE_SIZE), MAX_LINE_SIZE, MAX_LINE_SIZE_DEFAULT_VALUE);
        this.bucketName = getStringValue(lookup.apply(BUCKET), BUCKET_DEFAULT_VALUE);
        this.objectStoreEndpoint = getStringValue(lookup.apply(OBJECT_STORE_ENDPOINT),
                OBJECT_STORE_ENDPOINT_DEFAULT_VALUE);
        this.objectStoreRegion = getStringValue(lookup.apply(OBJECT_STORE_REGION),
                OBJECT_STORE_REGION_DEFAULT_VALUE);
        this.structuredTimestampsEnabled = getBooleanValue(lookup.apply(STRUCTURED_TIMESTAMPS),
                STRUCTURED_TIMESTAMPS, STRUCTURED_TIMESTAMPS_DEFAULT_VALUE);
    }

    /**
     * Helper method to get configuration value from System Parameter or environment.
     *
     * @param optionName name of the parameter/environment variable
     * @return the value or null
     */
    private static String getValue(String optionName) {
        //Get SystemProperty first, otherwise get from Environment
        String value = System.getProperty(optionName);
        if (value == null) {
            value = System.getenv(optionName);
        }
        return value;
    }

    private static String getStringValue(String value, String defaultValue) {
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return value.trim();
    }

    /**
     * Helper method that handles boolean parameters.
     *
     * @param value        value passed in through the parameter/environment variable.
     * @param optionName   name of the parameter/environment variable.
     * @param defaultValue default value.
     * @return returns the parsed value of the parameter. If the value passed to the parameter is not a
     *     valid boolean string, the default value for the parameter will be returned.
     */
    private static boolean getBooleanValue(String value, String optionName, boolean defaultValue) {
        if (value != null) {
            if ("true".equalsIgnoreCase(value)) {
                return true;
            } else if ("false".equalsIgnoreCase(value)) {
                return false;
            }
            LOGGER.warn("Unable to parse value {} for option {}. Using default value {}",
                    value, optionName, defaultValue);
        }
        return defaultValue;
    }

    /**
     * Parses sizes such as {@code 32MB} or {@code 512kb}. Values that do not parse, are not positive or do not fit
     * an int fall back to the default.
     */
    private static int getSizeValue(String value, String optionName, String defaultValue) {
        if (value != null) {
            try {
                long size = FileSize.valueOf(value.trim()).getSize();
                if (size > 0 && size <= Integer.MAX_VALUE) {
                    return (int) size;
                }
            } catch (IllegalArgumentException e) {
                LOGGER.atDebug().setCause(e).log("Invalid size {}", value);
            }
            LOGGER.warn("Unable to parse value {} for option {}. Using default value {}",
                    value, optionName, defaultValue);
        }
        return (int) FileSize.valueOf(defaultValue).getSize();
    }
}
