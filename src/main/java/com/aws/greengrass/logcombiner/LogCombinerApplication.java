/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner;

import com.aws.greengrass.logcombiner.exceptions.LogCombinerException;
import com.aws.greengrass.logcombiner.source.LogSourceProvider;
import com.aws.greengrass.logcombiner.source.LogSourceProviderFactory;
import com.aws.greengrass.logcombiner.util.LogCombinerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "log-combiner",
        description = "Merges the .log and build-log.txt files under a directory or an object store URL into one "
                + "time ordered stream on standard output.")
public class LogCombinerApplication implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(LogCombinerApplication.class);
    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;

    @Parameters(index = "0", paramLabel = "PATH", arity = "1",
            description = "Local directory or file, or an http(s) URL of a log bucket prefix")
    private String location;

    private final LogSourceProviderFactory providerFactory;
    private final LogCombinerConfig config;
    private final OutputStream out;

    public LogCombinerApplication() {
        this(new LogCombinerConfig(), System.out);
    }

    LogCombinerApplication(LogCombinerConfig config, OutputStream out) {
        this(new LogSourceProviderFactory(config), config, out);
    }

    LogCombinerApplication(LogSourceProviderFactory providerFactory, LogCombinerConfig config, OutputStream out) {
        this.providerFactory = providerFactory;
        this.config = config;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new LogCombinerApplication()).execute(args));
    }

    @Override
    public Integer call() {
        List<String> lines;
        try (LogSourceProvider provider = providerFactory.create(location)) {
            lines = new LogCombiner(provider, config).combine();
        } catch (LogCombinerException e) {
            logger.atError().addKeyValue("location", location).log(describe(e));
            logger.atDebug().setCause(e).log("Combine failed");
            return EXIT_FAILURE;
        }
        try {
            new MergedLogWriter(out).write(lines);
        } catch (IOException e) {
            logger.atError().setCause(e).log("Failed to write merged output");
            return EXIT_FAILURE;
        }
        return EXIT_SUCCESS;
    }

    private static String describe(LogCombinerException e) {
        Throwable cause = e.getCause();
        if (cause == null || cause.getMessage() == null) {
            return e.getMessage();
        }
        return e.getMessage() + ": " + cause.getMessage();
    }
}
