/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner.source;

import com.aws.greengrass.logcombiner.exceptions.EnumerationException;
import com.aws.greengrass.logcombiner.exceptions.SourceOpenException;
import com.aws.greengrass.logcombiner.model.SourceListing;

import java.io.InputStream;

/**
 * Lists the log sources under a root and opens them for reading.
 */
public interface LogSourceProvider extends AutoCloseable {
    String LOG_SUFFIX = ".log";
    String BUILD_LOG_SUFFIX = "build-log.txt";

    /**
     * Lists the sources under the root. The order of the listing defines each source's index.
     *
     * @return names of the qualifying sources and the prefix to strip from them for display
     * @throws EnumerationException if the root cannot be listed
     */
    SourceListing listSources() throws EnumerationException;

    /**
     * Opens a source returned by {@link #listSources()}. The caller closes the stream.
     *
     * @param name source name from the listing
     * @return the source's bytes
     * @throws SourceOpenException if the source cannot be opened
     */
    InputStream openStream(String name) throws SourceOpenException;

    @Override
    default void close() {
    }

    static boolean isLogName(String name) {
        return name.endsWith(LOG_SUFFIX) || name.endsWith(BUILD_LOG_SUFFIX);
    }
}
