/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner;

import com.aws.greengrass.logcombiner.exceptions.LogCombinerException;
import com.aws.greengrass.logcombiner.model.LogSource;
import com.aws.greengrass.logcombiner.model.SourceListing;
import com.aws.greengrass.logcombiner.model.TaggedLine;
import com.aws.greengrass.logcombiner.source.LogSourceProvider;
import com.aws.greengrass.logcombiner.timestamp.LineTimestampExtractor;
import com.aws.greengrass.logcombiner.util.LogCombinerConfig;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Reads every source concurrently and merges their lines into one time ordered list.
 */
public class LogCombiner {
    private static final Logger logger = LoggerFactory.getLogger(LogCombiner.class);
    private final LogSourceProvider provider;
    private final SourceLogsProcessor processor;

    /**
     * Constructor.
     *
     * @param provider lists and opens the sources
     * @param config   combiner configuration
     */
    public LogCombiner(LogSourceProvider provider, LogCombinerConfig config) {
        this(provider, new SourceLogsProcessor(provider, LineTimestampExtractor.create(config), new LineTagger(),
                config.getMaxLineLength()));
    }

    LogCombiner(LogSourceProvider provider, SourceLogsProcessor processor) {
        this.provider = provider;
        this.processor = processor;
    }

    /**
     * Lists the provider's sources and merges them.
     *
     * @return the merged display lines, in order
     * @throws LogCombinerException if listing fails or any source fails
     */
    public List<String> combine() throws LogCombinerException {
        SourceListing listing = provider.listSources();
        return merge(toSources(listing));
    }

    /**
     * Assigns indexes in listing order and strips the listing prefix for display.
     *
     * @param listing result of the provider's listing
     * @return one source per listed name
     */
    public static List<LogSource> toSources(SourceListing listing) {
        List<LogSource> sources = new ArrayList<>(listing.getNames().size());
        for (String name : listing.getNames()) {
            sources.add(LogSource.builder()
                    .index(sources.size())
                    .name(name)
                    .displayName(StringUtils.removeStart(name, listing.getPrefix()))
                    .build());
        }
        return sources;
    }

    /**
     * Merges the sources and returns the display lines without their sort keys.
     *
     * @param sources sources to merge
     * @return the merged display lines, in order
     * @throws LogCombinerException if any source fails
     */
    public List<String> merge(List<LogSource> sources) throws LogCombinerException {
        return mergeTaggedLines(sources).stream().map(TaggedLine::getDisplayLine).collect(Collectors.toList());
    }

    /**
     * Reads all sources at once, one thread each, then sorts all of their lines by sort key. The first failure
     * stops the remaining sources and is rethrown; nothing is returned in that case.
     *
     * @param sources sources to merge
     * @return every line of every source, ordered by sort key
     * @throws LogCombinerException if any source fails
     */
    public List<TaggedLine> mergeTaggedLines(List<LogSource> sources) throws LogCombinerException {
        if (sources.isEmpty()) {
            logger.atInfo().log("No log sources found");
            return Collections.emptyList();
        }
        logger.atInfo().addKeyValue("sources", sources.size()).log("Merging log sources");

        AtomicBoolean aborted = new AtomicBoolean(false);
        ExecutorService executor = Executors.newFixedThreadPool(sources.size(), workerThreadFactory());
        CompletionService<List<TaggedLine>> completionService = new ExecutorCompletionService<>(executor);
        try {
            for (LogSource source : sources) {
                completionService.submit(() -> processor.process(source, aborted::get));
            }
            // Batches arrive in completion order, the sort below is the only ordering authority.
            List<TaggedLine> combined = new ArrayList<>();
            for (int i = 0; i < sources.size(); i++) {
                try {
                    combined.addAll(completionService.take().get());
                } catch (ExecutionException e) {
                    aborted.set(true);
                    throw toCombinerException(e.getCause());
                }
            }
            combined.sort(Comparator.comparing(TaggedLine::getSortKey));
            logger.atInfo().addKeyValue("sources", sources.size()).addKeyValue("lines", combined.size())
                    .log("Merged log sources");
            return combined;
        } catch (InterruptedException e) {
            aborted.set(true);
            Thread.currentThread().interrupt();
            throw new LogCombinerException("Interrupted while merging log sources", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static LogCombinerException toCombinerException(Throwable cause) {
        if (cause instanceof LogCombinerException) {
            return (LogCombinerException) cause;
        }
        return new LogCombinerException("Unexpected failure while reading log sources", cause);
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger count = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "log-combiner-source-" + count.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
