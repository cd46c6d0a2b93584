/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner;

import com.aws.greengrass.logcombiner.exceptions.LineTooLongException;
import com.aws.greengrass.logcombiner.exceptions.SourceOpenException;
import com.aws.greengrass.logcombiner.exceptions.SourceScanException;
import com.aws.greengrass.logcombiner.model.LogSource;
import com.aws.greengrass.logcombiner.model.RollingTimeState;
import com.aws.greengrass.logcombiner.model.TaggedLine;
import com.aws.greengrass.logcombiner.source.LogSourceProvider;
import com.aws.greengrass.logcombiner.timestamp.LineTimestampExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Reads one source from start to end and tags every line with its time, day number, source index and row number.
 */
public class SourceLogsProcessor {
    private static final Logger logger = LoggerFactory.getLogger(SourceLogsProcessor.class);
    /**
     * Lines are decoded one char per byte so any byte sequence reaches the output unchanged.
     */
    public static final Charset LINE_CHARSET = StandardCharsets.ISO_8859_1;
    private final LogSourceProvider provider;
    private final LineTimestampExtractor extractor;
    private final LineTagger tagger;
    private final int maxLineLength;

    /**
     * Constructor.
     *
     * @param provider      opens the sources
     * @param extractor     finds the time of each line
     * @param tagger        builds the tagged lines
     * @param maxLineLength longest accepted line, in characters
     */
    public SourceLogsProcessor(LogSourceProvider provider, LineTimestampExtractor extractor, LineTagger tagger,
                               int maxLineLength) {
        this.provider = provider;
        this.extractor = extractor;
        this.tagger = tagger;
        this.maxLineLength = maxLineLength;
    }

    public List<TaggedLine> process(LogSource source) throws SourceOpenException, SourceScanException {
        return process(source, () -> false);
    }

    /**
     * Reads the source line by line, in file order.
     *
     * @param source    the source to read
     * @param cancelled checked before every line; once it returns true the source is abandoned
     * @return the tagged lines of the source, in read order
     * @throws SourceOpenException if the source cannot be opened
     * @throws SourceScanException if a line is too long, the stream fails mid-read or the read is cancelled
     */
    public List<TaggedLine> process(LogSource source, BooleanSupplier cancelled)
            throws SourceOpenException, SourceScanException {
        String name = source.getName();
        String provenanceTag = LineTagger.shortName(toLineText(source.getDisplayName()));
        RollingTimeState state = new RollingTimeState();
        List<TaggedLine> lines = new ArrayList<>();
        long rowNumber = 0;

        try (InputStream stream = provider.openStream(name);
             LineLengthLimitingReader reader = new LineLengthLimitingReader(
                     new InputStreamReader(stream, LINE_CHARSET), maxLineLength)) {
            while (true) {
                if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                    throw new SourceScanException(String.format("Reading %s was cancelled", name), true);
                }
                String line = reader.readLine();
                if (line == null) {
                    break;
                }
                rowNumber++;
                boolean rolledOver = state.hasRolledOver();
                extractor.find(line).ifPresent(state::advance);
                if (!rolledOver && state.hasRolledOver()) {
                    logger.atDebug().addKeyValue("source", name).addKeyValue("row", rowNumber)
                            .addKeyValue("firstTime", state.getFirstTime())
                            .log("Source appears to cross midnight");
                }
                lines.add(tagger.tag(state.getDayNumber(), state.getCurrentTime(), source.getIndex(), rowNumber,
                        provenanceTag, line));
            }
        } catch (LineTooLongException e) {
            throw new SourceScanException(String.format("Failed to scan %s at row %d: %s", name, rowNumber + 1,
                    e.getMessage()), e);
        } catch (IOException e) {
            throw new SourceScanException(String.format("Failed to read %s", name), e);
        }

        logger.atDebug().addKeyValue("source", name).addKeyValue("index", source.getIndex())
                .addKeyValue("lines", lines.size()).log("Finished reading source");
        return lines;
    }

    /**
     * Re-expresses a name in the same one-char-per-byte form as the lines, so the output is written with a
     * single charset.
     */
    static String toLineText(String name) {
        return new String(name.getBytes(StandardCharsets.UTF_8), LINE_CHARSET);
    }
}
