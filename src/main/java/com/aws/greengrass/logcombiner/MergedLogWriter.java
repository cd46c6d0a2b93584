/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.List;

/**
 * Writes the merged lines to the output in one pass, one byte per char as they were read. The underlying stream
 * is flushed but not closed.
 */
public class MergedLogWriter {
    private final OutputStream out;

    @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Writes go to the caller's stream")
    public MergedLogWriter(OutputStream out) {
        this.out = out;
    }

    /**
     * Writes each line followed by a line feed.
     *
     * @param lines merged lines, in order
     * @throws IOException if writing fails
     */
    public void write(List<String> lines) throws IOException {
        Writer writer = new BufferedWriter(new OutputStreamWriter(out, SourceLogsProcessor.LINE_CHARSET));
        for (String line : lines) {
            writer.write(line);
            writer.write('\n');
        }
        writer.flush();
    }
}
