/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner.source;

import com.aws.greengrass.logcombiner.exceptions.EnumerationException;
import com.aws.greengrass.logcombiner.util.LogCombinerConfig;
import com.aws.greengrass.logcombiner.util.ObjectStoreClientFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.regex.Pattern;

/**
 * Picks the provider for a location given on the command line: object store for http(s) URLs, local directory
 * tree for everything else.
 */
public class LogSourceProviderFactory {
    private static final Pattern URL_PATTERN = Pattern.compile("^https?://");

    private final LogCombinerConfig config;
    private final ObjectStoreClientFactory clientFactory;

    public LogSourceProviderFactory(LogCombinerConfig config) {
        this(config, new ObjectStoreClientFactory(config));
    }

    LogSourceProviderFactory(LogCombinerConfig config, ObjectStoreClientFactory clientFactory) {
        this.config = config;
        this.clientFactory = clientFactory;
    }

    public static boolean isUrl(String location) {
        return URL_PATTERN.matcher(location).find();
    }

    /**
     * Creates the provider for a location.
     *
     * @param location URL or local path
     * @return the provider, owned by the caller
     * @throws EnumerationException if the location cannot be interpreted
     */
    public LogSourceProvider create(String location) throws EnumerationException {
        if (isUrl(location)) {
            String prefix = ObjectStoreLogSourceProvider.prefixFromUrl(location, config.getBucketName());
            return new ObjectStoreLogSourceProvider(clientFactory.createClient(), config.getBucketName(), prefix);
        }
        try {
            return new LocalDirectoryLogSourceProvider(Paths.get(location));
        } catch (InvalidPathException e) {
            throw new EnumerationException(String.format("Invalid path %s", location), e);
        }
    }
}
